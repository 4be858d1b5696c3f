package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * LNS repair step: rebuilds a complete solution from a partial one.
 */
public interface RepairOperator<C> {

    void repair(Solution destroyed, Solution repaired, RandomSource random, C context);
}
