package Problem;

import Auxiliary.RandomSource;
import Solution.Solution;

/**
 * Recombines two parents into two children. Parents are read-only.
 */
public interface CrossoverFunction<C> {

    void crossover(Solution parent1, Solution parent2, Solution child1, Solution child2,
            RandomSource random, C context);
}
