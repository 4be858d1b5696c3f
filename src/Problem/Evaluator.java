package Problem;

import Solution.Solution;

/**
 * Counting wrapper around an {@link ObjectiveFunction}.
 *
 * Every objective call an engine makes goes through {@link #evaluate(Solution)},
 * so {@link #getNumEvaluations()} is exactly the number of objective calls.
 * A positive {@code maxEvaluations} turns the counter into a cooperative
 * budget that engines poll between iterations.
 */
public class Evaluator<C> {

    private final ObjectiveFunction<C> objective;
    private final C context;
    private final long maxEvaluations;
    private long numEvaluations;

    public Evaluator(ObjectiveFunction<C> objective, C context, long maxEvaluations) {
        this.objective = objective;
        this.context = context;
        this.maxEvaluations = maxEvaluations;
    }

    public double evaluate(Solution solution) {
        numEvaluations++;
        return objective.evaluate(solution, context);
    }

    public long getNumEvaluations() {
        return numEvaluations;
    }

    /**
     * @return true once the evaluation budget is used up (never when unlimited)
     */
    public boolean isExhausted() {
        return maxEvaluations > 0 && numEvaluations >= maxEvaluations;
    }

    public C getContext() {
        return context;
    }
}
