package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * Mutates {@code solution} in place.
 *
 * @param rate per-element mutation probability
 */
public interface MutationFunction<C> {

    void mutate(Solution solution, double rate, RandomSource random, C context);
}
