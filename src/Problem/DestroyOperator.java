package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * LNS destroy step: writes a partial solution derived from {@code solution}
 * into {@code destroyed}. How "removed" elements are marked is up to the
 * problem; only the matching {@link RepairOperator} reads it.
 *
 * @param degree fraction of elements to remove (0.0 - 1.0)
 */
public interface DestroyOperator<C> {

    void destroy(Solution solution, Solution destroyed, double degree, RandomSource random, C context);
}
