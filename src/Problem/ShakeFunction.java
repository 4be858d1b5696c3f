package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * VNS shaking: random point of neighborhood {@code k} (1..kMax) around
 * {@code current}. Larger k means a larger jump.
 */
public interface ShakeFunction<C> {

    void shake(Solution current, Solution out, int k, RandomSource random, C context);
}
