package SearchMethod;

/**
 * Configuration for Hill Climbing. maxIterations bounds the moves of each climb.
 */
public class HillClimbingConfig extends SearchConfig {

    private HillClimbingVariant variant;

    /** Neighbors sampled per move (Steepest, FirstImprovement, RandomRestart) */
    private int neighborsPerStep;
    private int numRestarts;

    /** Constant temperature of the Stochastic variant */
    private double temperature;

    public HillClimbingConfig() {
        super(1000);
        this.variant = HillClimbingVariant.Steepest;
        this.neighborsPerStep = 20;
        this.numRestarts = 10;
        this.temperature = 1.0;
    }

    public HillClimbingVariant getVariant() {
        return variant;
    }

    public void setVariant(HillClimbingVariant variant) {
        if (variant == null) throw new IllegalArgumentException("variant must not be null");
        this.variant = variant;
    }

    public int getNeighborsPerStep() {
        return neighborsPerStep;
    }

    public void setNeighborsPerStep(int n) {
        if (n < 1) throw new IllegalArgumentException("neighborsPerStep must be >= 1");
        this.neighborsPerStep = n;
    }

    public int getNumRestarts() {
        return numRestarts;
    }

    public void setNumRestarts(int n) {
        if (n < 1) throw new IllegalArgumentException("numRestarts must be >= 1");
        this.numRestarts = n;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double t) {
        if (t < 0) throw new IllegalArgumentException("temperature must be >= 0");
        this.temperature = t;
    }

    @Override
    public String toString() {
        return "HC: " + baseToString()
                + "\nvariant: " + variant
                + "\nneighborsPerStep: " + neighborsPerStep
                + "\nnumRestarts: " + numRestarts
                + "\ntemperature: " + temperature;
    }

    public HillClimbingConfig copy() {
        HillClimbingConfig copied = new HillClimbingConfig();
        copyBaseInto(copied);
        copied.variant = this.variant;
        copied.neighborsPerStep = this.neighborsPerStep;
        copied.numRestarts = this.numRestarts;
        copied.temperature = this.temperature;
        return copied;
    }
}
