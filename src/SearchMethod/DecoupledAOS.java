package SearchMethod;

import Auxiliary.RandomSource;

/**
 * Decoupled Adaptive Operator Selection for ALNS
 *
 * Destroy and repair operators are selected INDEPENDENTLY, each from its own
 * weighted pool (Pisinger & Ropke, 2019). Learning N + M weights instead of
 * N x M pair weights.
 *
 * Both operators used in an iteration receive the SAME reward for the
 * outcome of that iteration, and both pools reach their segment boundary on
 * the same iteration.
 *
 * USAGE:
 * ------
 * DecoupledAOS daos = new DecoupledAOS(destroyNames, repairNames, random, config);
 * int d = daos.selectDestroyOperator();
 * int r = daos.selectRepairOperator();
 * ...
 * daos.recordOutcome(d, r, outcome);
 */
public class DecoupledAOS {

    private final AdaptiveOperatorSelection destroyAOS;
    private final AdaptiveOperatorSelection repairAOS;

    public DecoupledAOS(
            String[] destroyOperators,
            String[] repairOperators,
            RandomSource random,
            ALNSConfig config) {

        this.destroyAOS = new AdaptiveOperatorSelection(destroyOperators, random, config);
        this.repairAOS = new AdaptiveOperatorSelection(repairOperators, random, config);
    }

    public int selectDestroyOperator() {
        return destroyAOS.selectOperator();
    }

    public int selectRepairOperator() {
        return repairAOS.selectOperator();
    }

    /**
     * Credit both operators of one destroy-repair application with the same reward.
     */
    public void recordOutcome(int destroyOperator, int repairOperator, OperatorOutcome outcome) {
        destroyAOS.recordOutcome(destroyOperator, outcome);
        repairAOS.recordOutcome(repairOperator, outcome);
    }

    /**
     * Print statistics for monitoring
     *
     * @param iteration Current iteration number
     */
    public void printStats(int iteration) {
        System.out.println("[Decoupled AOS] Iteration " + iteration);
        System.out.print("  Destroy: ");
        destroyAOS.printStats(iteration);
        System.out.print("  Repair:  ");
        repairAOS.printStats(iteration);
    }

    public AdaptiveOperatorSelection getDestroyAOS() {
        return destroyAOS;
    }

    public AdaptiveOperatorSelection getRepairAOS() {
        return repairAOS;
    }

    public int getIterationCounter() {
        return destroyAOS.getIterationCounter();
    }
}
