package SearchMethod;

/**
 * What a destroy/repair application led to, from most to least rewarded.
 */
public enum OperatorOutcome {
    NewGlobalBest,
    Improved,
    Accepted,
    Rejected
}
