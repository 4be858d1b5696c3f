package Population;

/**
 * Inertia schedule of the PSO velocity update.
 */
public enum InertiaType {
    /** w stays at inertiaWeight */
    Constant,
    /** w falls linearly from inertiaWeight to inertiaMin over the run */
    LinearDecreasing,
    /** Clerc-Kennedy constriction factor chi, used when c1 + c2 > 4 */
    Constriction
}
