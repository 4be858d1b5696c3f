package SearchMethod;

/**
 * Improvement step applied after each shake.
 */
public enum VNSVariant {
    /** shake + local search */
    Basic,
    /** shake only */
    Reduced,
    /** shake + variable neighborhood descent */
    General
}
