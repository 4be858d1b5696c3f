package SearchMethod;

/**
 * Move rule of the hill climber.
 */
public enum HillClimbingVariant {
    /** best of K sampled neighbors, stop when it is not strictly better */
    Steepest,
    /** first strictly better of up to K sampled neighbors, stop when none is */
    FirstImprovement,
    /** repeated steepest climbs from fresh random starts */
    RandomRestart,
    /** one neighbor per iteration, Metropolis acceptance at a constant temperature */
    Stochastic
}
