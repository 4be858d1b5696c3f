package Population;

/**
 * Pheromone deposit rule.
 */
public enum ACOVariant {
    /** every ant deposits Q / cost */
    AntSystem,
    /** Ant System plus elitistWeight * Q / best on the best-ever tour */
    Elitist,
    /** only the iteration best (global best every 5th iteration) deposits; trails kept in [tauMin, tauMax] */
    MaxMin
}
