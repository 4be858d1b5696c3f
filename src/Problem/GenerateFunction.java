package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * Writes one valid random initial solution into {@code out}.
 */
public interface GenerateFunction<C> {

    void generate(Solution out, RandomSource random, C context);
}
