package SearchMethod;

import Solution.Direction;

/**
 * Settings shared by every engine: budgets, direction, seed and console output.
 *
 * Budgets are cooperative: an engine stops after {@code maxIterations} outer
 * iterations, or earlier once {@code maxEvaluations} objective calls have been
 * made (0 = no evaluation budget). There is no other way to stop a run.
 */
public abstract class SearchConfig {

    protected int maxIterations;
    protected long maxEvaluations;
    protected Direction direction;
    protected long seed;

    // --------------------Print-------------------
    protected boolean print;
    protected int printFrequency;

    protected SearchConfig(int maxIterations) {
        this.maxIterations = maxIterations;
        this.maxEvaluations = 0;
        this.direction = Direction.Minimize;
        this.seed = 42;
        this.print = false;
        this.printFrequency = 100;
    }

    protected void copyBaseInto(SearchConfig target) {
        target.maxIterations = this.maxIterations;
        target.maxEvaluations = this.maxEvaluations;
        target.direction = this.direction;
        target.seed = this.seed;
        target.print = this.print;
        target.printFrequency = this.printFrequency;
    }

    /**
     * Whether a progress line should be printed after {@code iteration}.
     */
    public boolean shouldPrint(int iteration) {
        return print && printFrequency > 0 && (iteration + 1) % printFrequency == 0;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        if (maxIterations < 0) throw new IllegalArgumentException("maxIterations must be >= 0");
        this.maxIterations = maxIterations;
    }

    public long getMaxEvaluations() {
        return maxEvaluations;
    }

    public void setMaxEvaluations(long maxEvaluations) {
        if (maxEvaluations < 0) throw new IllegalArgumentException("maxEvaluations must be >= 0");
        this.maxEvaluations = maxEvaluations;
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        if (direction == null) throw new IllegalArgumentException("direction must not be null");
        this.direction = direction;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public boolean isPrint() {
        return print;
    }

    public void setPrint(boolean print) {
        this.print = print;
    }

    public int getPrintFrequency() {
        return printFrequency;
    }

    public void setPrintFrequency(int printFrequency) {
        if (printFrequency < 1) throw new IllegalArgumentException("printFrequency must be >= 1");
        this.printFrequency = printFrequency;
    }

    protected String baseToString() {
        return "\nmaxIterations: " + maxIterations
                + "\nmaxEvaluations: " + (maxEvaluations == 0 ? "unlimited" : String.valueOf(maxEvaluations))
                + "\ndirection: " + direction
                + "\nseed: " + seed;
    }
}
