package Population;

import SearchMethod.SearchConfig;

/**
 * Configuration for Ant Colony Optimization on permutation (tour) problems
 */
public class ACOConfig extends SearchConfig {

    private int numAnts;

    /** Pheromone exponent */
    private double alpha;

    /** Heuristic exponent */
    private double beta;

    /** Evaporation rate */
    private double rho;

    /** Deposit constant */
    private double q;

    /** Initial pheromone on every edge */
    private double tau0;

    private ACOVariant variant;
    private double elitistWeight;
    private double tauMin;
    private double tauMax;

    public ACOConfig() {
        super(500);
        this.numAnts = 20;
        this.alpha = 1.0;
        this.beta = 3.0;
        this.rho = 0.1;
        this.q = 1.0;
        this.tau0 = 0.1;
        this.variant = ACOVariant.AntSystem;
        this.elitistWeight = 2.0;
        this.tauMin = 0.001;
        this.tauMax = 10.0;
    }

    public int getNumAnts() {
        return numAnts;
    }

    public void setNumAnts(int n) {
        if (n < 1) throw new IllegalArgumentException("numAnts must be >= 1");
        this.numAnts = n;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        if (alpha < 0) throw new IllegalArgumentException("alpha must be >= 0");
        this.alpha = alpha;
    }

    public double getBeta() {
        return beta;
    }

    public void setBeta(double beta) {
        if (beta < 0) throw new IllegalArgumentException("beta must be >= 0");
        this.beta = beta;
    }

    public double getRho() {
        return rho;
    }

    public void setRho(double rho) {
        if (rho < 0 || rho > 1) throw new IllegalArgumentException("rho must be in [0,1]");
        this.rho = rho;
    }

    public double getQ() {
        return q;
    }

    public void setQ(double q) {
        if (q <= 0) throw new IllegalArgumentException("q must be > 0");
        this.q = q;
    }

    public double getTau0() {
        return tau0;
    }

    public void setTau0(double tau0) {
        if (tau0 <= 0) throw new IllegalArgumentException("tau0 must be > 0");
        this.tau0 = tau0;
    }

    public ACOVariant getVariant() {
        return variant;
    }

    public void setVariant(ACOVariant variant) {
        if (variant == null) throw new IllegalArgumentException("variant must not be null");
        this.variant = variant;
    }

    public double getElitistWeight() {
        return elitistWeight;
    }

    public void setElitistWeight(double weight) {
        if (weight < 0) throw new IllegalArgumentException("elitistWeight must be >= 0");
        this.elitistWeight = weight;
    }

    public double getTauMin() {
        return tauMin;
    }

    public double getTauMax() {
        return tauMax;
    }

    public void setTauBounds(double tauMin, double tauMax) {
        if (tauMin <= 0 || tauMax < tauMin) throw new IllegalArgumentException("need 0 < tauMin <= tauMax");
        this.tauMin = tauMin;
        this.tauMax = tauMax;
    }

    @Override
    public String toString() {
        return "ACO: " + baseToString()
                + "\nnumAnts: " + numAnts
                + String.format("\nalpha: %.2f | beta: %.2f | rho: %.3f | Q: %.3f | tau0: %.4f", alpha, beta, rho, q, tau0)
                + "\nvariant: " + variant
                + (variant == ACOVariant.Elitist ? " (weight=" + elitistWeight + ")" : "")
                + (variant == ACOVariant.MaxMin ? String.format(" ([%.4f, %.4f])", tauMin, tauMax) : "");
    }

    public ACOConfig copy() {
        ACOConfig copied = new ACOConfig();
        copyBaseInto(copied);
        copied.numAnts = this.numAnts;
        copied.alpha = this.alpha;
        copied.beta = this.beta;
        copied.rho = this.rho;
        copied.q = this.q;
        copied.tau0 = this.tau0;
        copied.variant = this.variant;
        copied.elitistWeight = this.elitistWeight;
        copied.tauMin = this.tauMin;
        copied.tauMax = this.tauMax;
        return copied;
    }
}
