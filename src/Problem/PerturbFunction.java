package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * Perturbation: a move stronger than a neighbor, used by ILS to escape the
 * basin of the current local optimum.
 *
 * @param strength 1 = weak, larger values = stronger kicks
 */
public interface PerturbFunction<C> {

    void perturb(Solution current, Solution out, int strength, RandomSource random, C context);
}
