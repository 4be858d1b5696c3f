package Population;

/**
 * How local search results feed back into the population.
 */
public enum LearningType {
    /** the improved solution replaces the genome */
    Lamarckian,
    /** only the fitness is replaced; the genome stays as bred */
    Baldwinian
}
