package SearchMethod;

/**
 * Temperature update applied by simulated annealing after each Markov chain.
 */
public enum CoolingSchedule {
    /** T = T * coolingRate */
    Geometric,
    /** T = T - (T0 - Tmin) / chains, where chains = ceil(maxIterations / chainLength) */
    Linear,
    /** T = T0 / ln(2 + k) after chain k */
    Logarithmic,
    /** heat when the chain acceptance rate is below adaptiveLow, cool when above adaptiveHigh */
    Adaptive
}
