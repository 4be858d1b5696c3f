package SearchMethod;

/**
 * Configuration for GRASP and Reactive GRASP
 *
 * Reactive mode replaces the fixed alpha by {@code numAlphas} candidates
 * i/(numAlphas+1), chosen by roulette over qualities re-estimated every
 * {@code reactiveBlockSize} iterations.
 */
public class GRASPConfig extends SearchConfig {

    /** Restricted candidate list parameter: 0 = greedy, 1 = random */
    private double alpha;

    // --------------------Local search-------------------
    private int lsMaxIterations;
    private int lsNeighbors;

    // --------------------Reactive-------------------
    private boolean reactive;
    private int numAlphas;
    private int reactiveBlockSize;

    public GRASPConfig() {
        super(500);
        this.alpha = 0.3;
        this.lsMaxIterations = 100;
        this.lsNeighbors = 20;
        this.reactive = false;
        this.numAlphas = 5;
        this.reactiveBlockSize = 50;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        if (alpha < 0 || alpha > 1) throw new IllegalArgumentException("alpha must be in [0,1]");
        this.alpha = alpha;
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

    public boolean isReactive() {
        return reactive;
    }

    public void setReactive(boolean reactive) {
        this.reactive = reactive;
    }

    public int getNumAlphas() {
        return numAlphas;
    }

    public void setNumAlphas(int n) {
        if (n < 1) throw new IllegalArgumentException("numAlphas must be >= 1");
        this.numAlphas = n;
    }

    public int getReactiveBlockSize() {
        return reactiveBlockSize;
    }

    public void setReactiveBlockSize(int n) {
        if (n < 1) throw new IllegalArgumentException("reactiveBlockSize must be >= 1");
        this.reactiveBlockSize = n;
    }

    @Override
    public String toString() {
        return "GRASP: " + baseToString()
                + "\nalpha: " + (reactive ? "reactive (" + numAlphas + " alphas, block=" + reactiveBlockSize + ")" : alpha)
                + "\nlocalSearch: " + lsMaxIterations + " rounds x " + lsNeighbors + " neighbors";
    }

    public GRASPConfig copy() {
        GRASPConfig copied = new GRASPConfig();
        copyBaseInto(copied);
        copied.alpha = this.alpha;
        copied.lsMaxIterations = this.lsMaxIterations;
        copied.lsNeighbors = this.lsNeighbors;
        copied.reactive = this.reactive;
        copied.numAlphas = this.numAlphas;
        copied.reactiveBlockSize = this.reactiveBlockSize;
        return copied;
    }
}
