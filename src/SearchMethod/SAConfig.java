package SearchMethod;

/**
 * Configuration for Simulated Annealing. maxIterations counts single moves.
 */
public class SAConfig extends SearchConfig {

    // --------------------Temperature-------------------
    private double initialTemperature;
    private double minTemperature;
    private double coolingRate;
    private CoolingSchedule cooling;

    /** Moves per temperature level */
    private int chainLength;

    // --------------------Reheating-------------------
    private boolean reheat;
    private double reheatThreshold;
    private double reheatFactor;

    // --------------------Calibration-------------------
    private boolean autoCalibrate;
    private int calibrationSamples;
    private double targetAcceptance;

    // --------------------Adaptive cooling-------------------
    private double adaptiveLow;
    private double adaptiveHigh;
    private double adaptiveFactor;

    public SAConfig() {
        super(10000);
        this.initialTemperature = 100.0;
        this.minTemperature = 0.001;
        this.coolingRate = 0.95;
        this.cooling = CoolingSchedule.Geometric;
        this.chainLength = 50;
        this.reheat = false;
        this.reheatThreshold = 0.01;
        this.reheatFactor = 2.0;
        this.autoCalibrate = false;
        this.calibrationSamples = 100;
        this.targetAcceptance = 0.8;
        this.adaptiveLow = 0.2;
        this.adaptiveHigh = 0.5;
        this.adaptiveFactor = 1.05;
    }

    public double getInitialTemperature() {
        return initialTemperature;
    }

    public void setInitialTemperature(double t) {
        if (t <= 0) throw new IllegalArgumentException("initialTemperature must be > 0");
        this.initialTemperature = t;
    }

    public double getMinTemperature() {
        return minTemperature;
    }

    public void setMinTemperature(double t) {
        if (t < 0) throw new IllegalArgumentException("minTemperature must be >= 0");
        this.minTemperature = t;
    }

    public double getCoolingRate() {
        return coolingRate;
    }

    public void setCoolingRate(double alpha) {
        if (alpha <= 0 || alpha >= 1) throw new IllegalArgumentException("coolingRate must be in (0,1)");
        this.coolingRate = alpha;
    }

    public CoolingSchedule getCooling() {
        return cooling;
    }

    public void setCooling(CoolingSchedule cooling) {
        if (cooling == null) throw new IllegalArgumentException("cooling must not be null");
        this.cooling = cooling;
    }

    public int getChainLength() {
        return chainLength;
    }

    public void setChainLength(int length) {
        if (length < 1) throw new IllegalArgumentException("chainLength must be >= 1");
        this.chainLength = length;
    }

    public boolean isReheat() {
        return reheat;
    }

    public void setReheat(boolean reheat) {
        this.reheat = reheat;
    }

    public double getReheatThreshold() {
        return reheatThreshold;
    }

    public void setReheatThreshold(double threshold) {
        if (threshold < 0 || threshold > 1) throw new IllegalArgumentException("reheatThreshold must be in [0,1]");
        this.reheatThreshold = threshold;
    }

    public double getReheatFactor() {
        return reheatFactor;
    }

    public void setReheatFactor(double factor) {
        if (factor <= 1) throw new IllegalArgumentException("reheatFactor must be > 1");
        this.reheatFactor = factor;
    }

    public boolean isAutoCalibrate() {
        return autoCalibrate;
    }

    public void setAutoCalibrate(boolean autoCalibrate) {
        this.autoCalibrate = autoCalibrate;
    }

    public int getCalibrationSamples() {
        return calibrationSamples;
    }

    public void setCalibrationSamples(int samples) {
        if (samples < 1) throw new IllegalArgumentException("calibrationSamples must be >= 1");
        this.calibrationSamples = samples;
    }

    public double getTargetAcceptance() {
        return targetAcceptance;
    }

    public void setTargetAcceptance(double p) {
        if (p <= 0 || p >= 1) throw new IllegalArgumentException("targetAcceptance must be in (0,1)");
        this.targetAcceptance = p;
    }

    public double getAdaptiveLow() {
        return adaptiveLow;
    }

    public double getAdaptiveHigh() {
        return adaptiveHigh;
    }

    /**
     * Acceptance-rate band of the Adaptive schedule.
     */
    public void setAdaptiveBand(double low, double high) {
        if (low < 0 || high > 1 || !(low < high)) throw new IllegalArgumentException("adaptive band must satisfy 0 <= low < high <= 1");
        this.adaptiveLow = low;
        this.adaptiveHigh = high;
    }

    public double getAdaptiveFactor() {
        return adaptiveFactor;
    }

    public void setAdaptiveFactor(double factor) {
        if (factor <= 1) throw new IllegalArgumentException("adaptiveFactor must be > 1");
        this.adaptiveFactor = factor;
    }

    @Override
    public String toString() {
        return "SA: " + baseToString()
                + String.format("\ntemperature: T0=%.4f Tmin=%.4f", initialTemperature, minTemperature)
                + "\ncooling: " + cooling + " (rate " + coolingRate + ")"
                + "\nchainLength: " + chainLength
                + "\nreheat: " + reheat + " (threshold " + reheatThreshold + ", factor " + reheatFactor + ")"
                + "\nautoCalibrate: " + autoCalibrate + " (" + calibrationSamples + " samples, target " + targetAcceptance + ")"
                + "\nadaptive: [" + adaptiveLow + ", " + adaptiveHigh + "] x" + adaptiveFactor;
    }

    public SAConfig copy() {
        SAConfig copied = new SAConfig();
        copyBaseInto(copied);
        copied.initialTemperature = this.initialTemperature;
        copied.minTemperature = this.minTemperature;
        copied.coolingRate = this.coolingRate;
        copied.cooling = this.cooling;
        copied.chainLength = this.chainLength;
        copied.reheat = this.reheat;
        copied.reheatThreshold = this.reheatThreshold;
        copied.reheatFactor = this.reheatFactor;
        copied.autoCalibrate = this.autoCalibrate;
        copied.calibrationSamples = this.calibrationSamples;
        copied.targetAcceptance = this.targetAcceptance;
        copied.adaptiveLow = this.adaptiveLow;
        copied.adaptiveHigh = this.adaptiveHigh;
        copied.adaptiveFactor = this.adaptiveFactor;
        return copied;
    }
}
