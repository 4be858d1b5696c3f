package SearchMethod;

import DiversityControl.AcceptanceType;

/**
 * Configuration for Iterated Local Search
 */
public class ILSConfig extends SearchConfig {

    // --------------------Local search-------------------
    private int lsMaxIterations;
    private int lsNeighbors;

    /** Perturbation strength (number of chained moves when no perturb function is given) */
    private int perturbationStrength;

    // --------------------Acceptance-------------------
    private AcceptanceType acceptanceType;
    private double initialTemperature;
    private double coolingRate;
    private int restartThreshold;

    public ILSConfig() {
        super(1000);
        this.lsMaxIterations = 200;
        this.lsNeighbors = 20;
        this.perturbationStrength = 1;
        this.acceptanceType = AcceptanceType.Better;
        this.initialTemperature = 10.0;
        this.coolingRate = 0.95;
        this.restartThreshold = 50;
    }

    public int getLsMaxIterations() {
        return lsMaxIterations;
    }

    public void setLsMaxIterations(int n) {
        if (n < 0) throw new IllegalArgumentException("lsMaxIterations must be >= 0");
        this.lsMaxIterations = n;
    }

    public int getLsNeighbors() {
        return lsNeighbors;
    }

    public void setLsNeighbors(int n) {
        if (n < 1) throw new IllegalArgumentException("lsNeighbors must be >= 1");
        this.lsNeighbors = n;
    }

    public int getPerturbationStrength() {
        return perturbationStrength;
    }

    public void setPerturbationStrength(int strength) {
        if (strength < 1) throw new IllegalArgumentException("perturbationStrength must be >= 1");
        this.perturbationStrength = strength;
    }

    public AcceptanceType getAcceptanceType() {
        return acceptanceType;
    }

    public void setAcceptanceType(AcceptanceType type) {
        if (type == null) throw new IllegalArgumentException("acceptanceType must not be null");
        this.acceptanceType = type;
    }

    public double getInitialTemperature() {
        return initialTemperature;
    }

    public void setInitialTemperature(double t) {
        if (t < 0) throw new IllegalArgumentException("initialTemperature must be >= 0");
        this.initialTemperature = t;
    }

    public double getCoolingRate() {
        return coolingRate;
    }

    public void setCoolingRate(double alpha) {
        if (alpha <= 0 || alpha > 1) throw new IllegalArgumentException("coolingRate must be in (0,1]");
        this.coolingRate = alpha;
    }

    public int getRestartThreshold() {
        return restartThreshold;
    }

    public void setRestartThreshold(int threshold) {
        if (threshold < 0) throw new IllegalArgumentException("restartThreshold must be >= 0");
        this.restartThreshold = threshold;
    }

    @Override
    public String toString() {
        return "ILS: " + baseToString()
                + "\nlocalSearch: " + lsMaxIterations + " rounds x " + lsNeighbors + " neighbors"
                + "\nperturbationStrength: " + perturbationStrength
                + "\nacceptance: " + acceptanceType
                + "\ninitialTemperature: " + initialTemperature
                + "\ncoolingRate: " + coolingRate
                + "\nrestartThreshold: " + restartThreshold;
    }

    public ILSConfig copy() {
        ILSConfig copied = new ILSConfig();
        copyBaseInto(copied);
        copied.lsMaxIterations = this.lsMaxIterations;
        copied.lsNeighbors = this.lsNeighbors;
        copied.perturbationStrength = this.perturbationStrength;
        copied.acceptanceType = this.acceptanceType;
        copied.initialTemperature = this.initialTemperature;
        copied.coolingRate = this.coolingRate;
        copied.restartThreshold = this.restartThreshold;
        return copied;
    }
}
