package Problem;

import Solution.Solution;

/**
 * Objective function: cost of a solution.
 *
 * Must be a pure function of the buffer and the context. Engines count every
 * call as one evaluation (through {@link Evaluator}), and the evaluation
 * accounting of each engine depends on this contract.
 *
 * @param <C> problem context, passed through unmodified
 */
public interface ObjectiveFunction<C> {

    double evaluate(Solution solution, C context);
}
