package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * Writes one randomized neighbor of {@code current} into {@code out}.
 *
 * {@code out} is a different buffer of the same shape; implementations must
 * not assume it aliases {@code current} and must not modify {@code current}.
 */
public interface NeighborFunction<C> {

    void neighbor(Solution current, Solution out, RandomSource random, C context);
}
