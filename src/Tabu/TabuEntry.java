package Tabu;

/**
 * One tabu list entry: a solution hash and the iteration it was made tabu.
 * Iteration -1 marks the initial solution.
 */
public class TabuEntry {

    /** Hash of the forbidden solution */
    public final long hash;

    /** Iteration when the hash was inserted */
    public final int iteration;

    public TabuEntry(long hash, int iteration) {
        this.hash = hash;
        this.iteration = iteration;
    }

    @Override
    public String toString() {
        return String.format("TabuEntry[hash=%016x, iter=%d]", hash, iteration);
    }
}
