package Tabu;

import SearchMethod.SearchConfig;

/**
 * Configuration for reactive dual-memory Tabu Search
 *
 * Memories:
 * - Recency (tabu list): hashes of the last {@code tenure} incumbents
 * - Frequency: visit counts per hash, used by diversification and intensification
 *
 * Reactive control (optional) grows the tenure when the walk revisits a recent
 * solution and shrinks it after a quiet stretch.
 */
public class TabuConfig extends SearchConfig {

    /** Candidates sampled (and evaluated) per iteration */
    private int neighborsPerIteration;

    /** Initial tabu tenure (list capacity) */
    private int tenure;

    /** Allow tabu candidates that beat the best-ever cost */
    private boolean aspiration;

    // --------------------Diversification-------------------
    private boolean diversification;
    private double diversificationWeight;
    private int diversificationTrigger;

    // --------------------Intensification-------------------
    private boolean intensification;
    private int intensificationTrigger;

    // --------------------Reactive tenure-------------------
    private boolean reactive;
    private int reactiveIncrease;
    private int reactiveDecrease;
    private int minTenure;
    private int maxTenure;
    private int cycleWindow;
    private int reactiveDecreaseInterval;

    /** Optional per-iteration callback */
    private TabuObserver observer;

    /**
     * Constructor with recommended defaults
     */
    public TabuConfig() {
        super(5000);
        this.neighborsPerIteration = 20;
        this.tenure = 15;
        this.aspiration = true;

        this.diversification = false;
        this.diversificationWeight = 0.1;
        this.diversificationTrigger = 100;

        this.intensification = false;
        this.intensificationTrigger = 50;

        this.reactive = false;
        this.reactiveIncrease = 5;
        this.reactiveDecrease = 1;
        this.minTenure = 5;
        this.maxTenure = 50;
        this.cycleWindow = 50;
        this.reactiveDecreaseInterval = 100;

        this.observer = null;
    }

    /**
     * @return whether the frequency memory has to be maintained
     */
    public boolean usesFrequencyMemory() {
        return diversification || intensification;
    }

    public int getNeighborsPerIteration() {
        return neighborsPerIteration;
    }

    public void setNeighborsPerIteration(int n) {
        if (n < 1) throw new IllegalArgumentException("neighborsPerIteration must be >= 1");
        this.neighborsPerIteration = n;
    }

    public int getTenure() {
        return tenure;
    }

    public void setTenure(int tenure) {
        if (tenure < 1) throw new IllegalArgumentException("tenure must be >= 1");
        this.tenure = tenure;
    }

    public boolean isAspiration() {
        return aspiration;
    }

    public void setAspiration(boolean aspiration) {
        this.aspiration = aspiration;
    }

    public boolean isDiversification() {
        return diversification;
    }

    public void setDiversification(boolean diversification) {
        this.diversification = diversification;
    }

    public double getDiversificationWeight() {
        return diversificationWeight;
    }

    public void setDiversificationWeight(double weight) {
        if (weight < 0) throw new IllegalArgumentException("diversificationWeight must be >= 0");
        this.diversificationWeight = weight;
    }

    public int getDiversificationTrigger() {
        return diversificationTrigger;
    }

    public void setDiversificationTrigger(int trigger) {
        if (trigger < 1) throw new IllegalArgumentException("diversificationTrigger must be >= 1");
        this.diversificationTrigger = trigger;
    }

    public boolean isIntensification() {
        return intensification;
    }

    public void setIntensification(boolean intensification) {
        this.intensification = intensification;
    }

    public int getIntensificationTrigger() {
        return intensificationTrigger;
    }

    public void setIntensificationTrigger(int trigger) {
        if (trigger < 1) throw new IllegalArgumentException("intensificationTrigger must be >= 1");
        this.intensificationTrigger = trigger;
    }

    public boolean isReactive() {
        return reactive;
    }

    public void setReactive(boolean reactive) {
        this.reactive = reactive;
    }

    public int getReactiveIncrease() {
        return reactiveIncrease;
    }

    public void setReactiveIncrease(int increase) {
        if (increase < 0) throw new IllegalArgumentException("reactiveIncrease must be >= 0");
        this.reactiveIncrease = increase;
    }

    public int getReactiveDecrease() {
        return reactiveDecrease;
    }

    public void setReactiveDecrease(int decrease) {
        if (decrease < 0) throw new IllegalArgumentException("reactiveDecrease must be >= 0");
        this.reactiveDecrease = decrease;
    }

    public int getMinTenure() {
        return minTenure;
    }

    public int getMaxTenure() {
        return maxTenure;
    }

    /**
     * Set the reactive tenure range.
     */
    public void setTenureRange(int minTenure, int maxTenure) {
        if (minTenure < 1) throw new IllegalArgumentException("minTenure must be >= 1");
        if (maxTenure < minTenure) throw new IllegalArgumentException("maxTenure must be >= minTenure");
        this.minTenure = minTenure;
        this.maxTenure = maxTenure;
    }

    public int getCycleWindow() {
        return cycleWindow;
    }

    public void setCycleWindow(int window) {
        if (window < 1) throw new IllegalArgumentException("cycleWindow must be >= 1");
        this.cycleWindow = window;
    }

    public int getReactiveDecreaseInterval() {
        return reactiveDecreaseInterval;
    }

    public void setReactiveDecreaseInterval(int interval) {
        if (interval < 1) throw new IllegalArgumentException("reactiveDecreaseInterval must be >= 1");
        this.reactiveDecreaseInterval = interval;
    }

    public TabuObserver getObserver() {
        return observer;
    }

    public void setObserver(TabuObserver observer) {
        this.observer = observer;
    }

    @Override
    public String toString() {
        return "Tabu: "
                + baseToString()
                + "\nneighborsPerIteration: " + neighborsPerIteration
                + "\ntenure: " + tenure
                + "\naspiration: " + aspiration
                + "\ndiversification: " + (diversification
                        ? String.format("on (weight=%.3f, trigger=%d)", diversificationWeight, diversificationTrigger)
                        : "off")
                + "\nintensification: " + (intensification
                        ? String.format("on (trigger=%d)", intensificationTrigger)
                        : "off")
                + "\nreactive: " + (reactive
                        ? String.format("on (+%d/-%d, range=[%d,%d], window=%d, decreaseInterval=%d)",
                                reactiveIncrease, reactiveDecrease, minTenure, maxTenure,
                                cycleWindow, reactiveDecreaseInterval)
                        : "off");
    }

    /**
     * Create a deep copy of this configuration (the observer is shared)
     */
    public TabuConfig copy() {
        TabuConfig copied = new TabuConfig();
        copyBaseInto(copied);
        copied.neighborsPerIteration = this.neighborsPerIteration;
        copied.tenure = this.tenure;
        copied.aspiration = this.aspiration;
        copied.diversification = this.diversification;
        copied.diversificationWeight = this.diversificationWeight;
        copied.diversificationTrigger = this.diversificationTrigger;
        copied.intensification = this.intensification;
        copied.intensificationTrigger = this.intensificationTrigger;
        copied.reactive = this.reactive;
        copied.reactiveIncrease = this.reactiveIncrease;
        copied.reactiveDecrease = this.reactiveDecrease;
        copied.minTenure = this.minTenure;
        copied.maxTenure = this.maxTenure;
        copied.cycleWindow = this.cycleWindow;
        copied.reactiveDecreaseInterval = this.reactiveDecreaseInterval;
        copied.observer = this.observer;
        return copied;
    }
}
