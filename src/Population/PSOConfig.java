package Population;

import SearchMethod.SearchConfig;

/**
 * Configuration for Particle Swarm Optimization over a box [lowerBound, upperBound]^D
 */
public class PSOConfig extends SearchConfig {

    private int swarmSize;
    private double inertiaWeight;
    private double inertiaMin;
    private double c1;
    private double c2;

    /** Velocity limit as a fraction of the search range */
    private double vMaxRatio;
    private InertiaType inertiaType;
    private double lowerBound;
    private double upperBound;

    public PSOConfig() {
        super(500);
        this.swarmSize = 30;
        this.inertiaWeight = 0.729;
        this.inertiaMin = 0.4;
        this.c1 = 1.49445;
        this.c2 = 1.49445;
        this.vMaxRatio = 0.1;
        this.inertiaType = InertiaType.LinearDecreasing;
        this.lowerBound = -5.12;
        this.upperBound = 5.12;
    }

    /**
     * Inertia for {@code iteration} of the run.
     */
    public double inertiaAt(int iteration) {
        switch (inertiaType) {
            case LinearDecreasing:
                return inertiaWeight - (inertiaWeight - inertiaMin) * ((double) iteration / maxIterations);
            case Constriction:
                return constrictionFactor();
            case Constant:
            default:
                return inertiaWeight;
        }
    }

    /**
     * chi = 2 / |2 - phi - sqrt(phi^2 - 4 phi)| with phi = c1 + c2; 1 when phi <= 4.
     */
    public double constrictionFactor() {
        double phi = c1 + c2;
        if (phi <= 4.0) {
            return 1.0;
        }
        return 2.0 / Math.abs(2.0 - phi - Math.sqrt(phi * phi - 4.0 * phi));
    }

    public int getSwarmSize() {
        return swarmSize;
    }

    public void setSwarmSize(int size) {
        if (size < 1) throw new IllegalArgumentException("swarmSize must be >= 1");
        this.swarmSize = size;
    }

    public double getInertiaWeight() {
        return inertiaWeight;
    }

    public void setInertiaWeight(double w) {
        this.inertiaWeight = w;
    }

    public double getInertiaMin() {
        return inertiaMin;
    }

    public void setInertiaMin(double w) {
        this.inertiaMin = w;
    }

    public double getC1() {
        return c1;
    }

    public double getC2() {
        return c2;
    }

    /**
     * Set the cognitive (c1) and social (c2) coefficients.
     */
    public void setAcceleration(double c1, double c2) {
        if (c1 < 0 || c2 < 0) throw new IllegalArgumentException("acceleration coefficients must be >= 0");
        this.c1 = c1;
        this.c2 = c2;
    }

    public double getVMaxRatio() {
        return vMaxRatio;
    }

    public void setVMaxRatio(double ratio) {
        if (ratio <= 0) throw new IllegalArgumentException("vMaxRatio must be > 0");
        this.vMaxRatio = ratio;
    }

    public InertiaType getInertiaType() {
        return inertiaType;
    }

    public void setInertiaType(InertiaType type) {
        if (type == null) throw new IllegalArgumentException("inertiaType must not be null");
        this.inertiaType = type;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public void setBounds(double lower, double upper) {
        if (!(upper > lower)) throw new IllegalArgumentException("upperBound must be > lowerBound");
        this.lowerBound = lower;
        this.upperBound = upper;
    }

    @Override
    public String toString() {
        return "PSO: " + baseToString()
                + "\nswarmSize: " + swarmSize
                + String.format("\ninertia: %s (w=%.3f, wMin=%.3f)", inertiaType, inertiaWeight, inertiaMin)
                + String.format("\nc1: %.5f | c2: %.5f", c1, c2)
                + "\nvMaxRatio: " + vMaxRatio
                + String.format("\nbounds: [%.3f, %.3f]", lowerBound, upperBound);
    }

    public PSOConfig copy() {
        PSOConfig copied = new PSOConfig();
        copyBaseInto(copied);
        copied.swarmSize = this.swarmSize;
        copied.inertiaWeight = this.inertiaWeight;
        copied.inertiaMin = this.inertiaMin;
        copied.c1 = this.c1;
        copied.c2 = this.c2;
        copied.vMaxRatio = this.vMaxRatio;
        copied.inertiaType = this.inertiaType;
        copied.lowerBound = this.lowerBound;
        copied.upperBound = this.upperBound;
        return copied;
    }
}
