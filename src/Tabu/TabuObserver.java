package Tabu;

/**
 * Per-iteration callback for Tabu Search.
 */
public interface TabuObserver {

    /**
     * @param iteration      iteration just completed (0-based)
     * @param tabuListSize   entries in the tabu list after insertion and eviction
     * @param tenure         tenure in force after this iteration
     * @param aspirationUsed whether the chosen candidate was tabu but aspirated
     * @param currentCost    cost of the incumbent
     * @param bestCost       best-ever cost
     */
    void iterationCompleted(int iteration, int tabuListSize, int tenure,
                            boolean aspirationUsed, double currentCost, double bestCost);
}
