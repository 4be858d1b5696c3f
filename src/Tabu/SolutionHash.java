package Tabu;

import Solution.Solution;

/**
 * Hash identifying a solution in the tabu list and the frequency memory.
 * Equal solutions must hash equally; canonicalizing hashes (e.g. tour
 * rotations) may also map different buffers to the same value.
 */
public interface SolutionHash {

    long hash(Solution solution);
}
