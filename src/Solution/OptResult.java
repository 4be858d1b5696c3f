package Solution;

import java.util.Arrays;

/**
 * Outcome of one engine run.
 *
 * Owns an independent copy of the best solution, its cost, the iteration and
 * evaluation counters, the wall time and the convergence history
 * (best-so-far cost after each iteration, index = iteration number).
 *
 * An empty result (no best solution, zero counters) is what a run returns when
 * its configuration is unusable or when it aborts before the first evaluation.
 */
public class OptResult {

    private Solution best;
    private double bestCost;
    private final double[] convergence;
    private int numIterations;
    private long numEvaluations;
    private double elapsedTimeMs;

    public OptResult(int maxIterations) {
        this.convergence = new double[Math.max(0, maxIterations)];
        this.bestCost = Double.NaN;
    }

    public static OptResult empty() {
        return new OptResult(0);
    }

    /**
     * Copy {@code solution} into the owned best buffer. The buffer is created
     * on first use and reused afterwards.
     */
    public void updateBest(Solution solution, double cost) {
        if (best == null || !best.sameShape(solution)) {
            best = new Solution(solution.getElementSize(), solution.getSize());
        }
        best.copyFrom(solution);
        bestCost = cost;
    }

    /**
     * Record the best-so-far cost reached at the end of {@code iteration}.
     */
    public void recordIteration(int iteration, double bestSoFar) {
        if (iteration < convergence.length) {
            convergence[iteration] = bestSoFar;
        }
        numIterations = iteration + 1;
    }

    public void setNumEvaluations(long numEvaluations) {
        this.numEvaluations = numEvaluations;
    }

    public void setElapsedTimeMs(double elapsedTimeMs) {
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public boolean isEmpty() {
        return best == null;
    }

    /**
     * @return the best solution, or null for an empty result
     */
    public Solution getBest() {
        return best;
    }

    public double getBestCost() {
        return bestCost;
    }

    public int getNumIterations() {
        return numIterations;
    }

    public long getNumEvaluations() {
        return numEvaluations;
    }

    public double getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    /**
     * @return convergence history trimmed to the iterations actually run
     */
    public double[] getConvergence() {
        return Arrays.copyOf(convergence, Math.min(numIterations, convergence.length));
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "OptResult[empty]";
        }
        return String.format("OptResult[best=%.6f, iterations=%d, evaluations=%d, time=%.1fms]",
                bestCost, numIterations, numEvaluations, elapsedTimeMs);
    }
}
