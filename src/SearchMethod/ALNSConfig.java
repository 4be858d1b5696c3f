package SearchMethod;

/**
 * Configuration for Adaptive Large Neighborhood Search
 *
 * Adds the operator weight learning parameters to {@link LNSConfig}:
 * - rewards for new global best / better than incumbent / accepted
 * - segment length (weightUpdateInterval) and decay of the weight update
 */
public class ALNSConfig extends LNSConfig {

    private double rewardBest;
    private double rewardBetter;
    private double rewardAccepted;
    private int weightUpdateInterval;
    private double decay;

    public ALNSConfig() {
        super();
        this.rewardBest = 10.0;
        this.rewardBetter = 5.0;
        this.rewardAccepted = 1.0;
        this.weightUpdateInterval = 50;
        this.decay = 0.8;
    }

    public double getRewardBest() {
        return rewardBest;
    }

    public double getRewardBetter() {
        return rewardBetter;
    }

    public double getRewardAccepted() {
        return rewardAccepted;
    }

    /**
     * Set the three rewards (new best, better than incumbent, accepted).
     */
    public void setRewards(double best, double better, double accepted) {
        if (best < 0 || better < 0 || accepted < 0) throw new IllegalArgumentException("rewards must be >= 0");
        this.rewardBest = best;
        this.rewardBetter = better;
        this.rewardAccepted = accepted;
    }

    public int getWeightUpdateInterval() {
        return weightUpdateInterval;
    }

    public void setWeightUpdateInterval(int interval) {
        if (interval < 1) throw new IllegalArgumentException("weightUpdateInterval must be >= 1");
        this.weightUpdateInterval = interval;
    }

    public double getDecay() {
        return decay;
    }

    public void setDecay(double decay) {
        if (decay < 0 || decay > 1) throw new IllegalArgumentException("decay must be in [0,1]");
        this.decay = decay;
    }

    @Override
    public String toString() {
        return "ALNS: " + baseToString() + acceptanceToString()
                + String.format("\nrewards: best=%.1f better=%.1f accepted=%.1f", rewardBest, rewardBetter, rewardAccepted)
                + "\nweightUpdateInterval: " + weightUpdateInterval
                + "\ndecay: " + decay;
    }

    @Override
    public ALNSConfig copy() {
        ALNSConfig copied = new ALNSConfig();
        copyLnsInto(copied);
        copied.rewardBest = this.rewardBest;
        copied.rewardBetter = this.rewardBetter;
        copied.rewardAccepted = this.rewardAccepted;
        copied.weightUpdateInterval = this.weightUpdateInterval;
        copied.decay = this.decay;
        return copied;
    }
}
