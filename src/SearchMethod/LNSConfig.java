package SearchMethod;

import DiversityControl.AcceptanceType;

/**
 * Configuration for Large Neighborhood Search (destroy, repair, accept).
 */
public class LNSConfig extends SearchConfig {

    /** Fraction of the solution the destroy operator removes (0-1] */
    protected double destroyDegree;

    // --------------------Acceptance-------------------
    protected AcceptanceType acceptanceType;
    protected double initialTemperature;
    protected double coolingRate;
    protected int restartThreshold;

    public LNSConfig() {
        super(1000);
        this.destroyDegree = 0.3;
        this.acceptanceType = AcceptanceType.Better;
        this.initialTemperature = 100.0;
        this.coolingRate = 0.99;
        this.restartThreshold = 50;
    }

    protected void copyLnsInto(LNSConfig target) {
        copyBaseInto(target);
        target.destroyDegree = this.destroyDegree;
        target.acceptanceType = this.acceptanceType;
        target.initialTemperature = this.initialTemperature;
        target.coolingRate = this.coolingRate;
        target.restartThreshold = this.restartThreshold;
    }

    public double getDestroyDegree() {
        return destroyDegree;
    }

    public void setDestroyDegree(double degree) {
        if (degree <= 0 || degree > 1) throw new IllegalArgumentException("destroyDegree must be in (0,1]");
        this.destroyDegree = degree;
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

    protected String acceptanceToString() {
        return "\ndestroyDegree: " + destroyDegree
                + "\nacceptance: " + acceptanceType
                + (acceptanceType == AcceptanceType.SALike
                        ? String.format(" (T0=%.3f, alpha=%.4f)", initialTemperature, coolingRate) : "")
                + (acceptanceType == AcceptanceType.Restart
                        ? " (threshold=" + restartThreshold + ")" : "");
    }

    @Override
    public String toString() {
        return "LNS: " + baseToString() + acceptanceToString();
    }

    public LNSConfig copy() {
        LNSConfig copied = new LNSConfig();
        copyLnsInto(copied);
        return copied;
    }
}
