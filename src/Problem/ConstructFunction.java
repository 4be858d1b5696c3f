package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * Greedy randomized construction (GRASP).
 *
 * @param alpha restricted candidate list parameter: 0.0 = pure greedy,
 *              1.0 = pure random
 */
public interface ConstructFunction<C> {

    void construct(Solution out, double alpha, RandomSource random, C context);
}
