package SearchMethod;

import java.util.Arrays;

import Auxiliary.RandomSource;

/**
 * Adaptive Operator Selection (AOS) for one operator pool
 *
 * Segment-based weight learning after Ropke & Pisinger (2006)
 * "An Adaptive Large Neighborhood Search Heuristic for the Pickup and Delivery
 * Problem with Time Windows"
 *
 * KEY DESIGN PRINCIPLES:
 * ----------------------
 * 1. **Segmented Learning:** Rewards accumulate over N iterations without
 * touching the weights; weights change only at segment boundaries
 * 2. **Hard Reset:** After each segment, scores and uses go back to 0
 * 3. **Floor Constraint:** Every weight stays >= MIN_WEIGHT (0.01), so no
 * operator goes extinct and the weight sum stays positive
 * 4. **Roulette Wheel:** Selection probability proportional to weight
 *
 * SCORING SYSTEM:
 * ---------------
 * - rewardBest:     operator led to a new global best solution
 * - rewardBetter:   operator led to a solution better than the incumbent
 * - rewardAccepted: operator led to a solution the acceptance criterion took
 * - 0:              rejected
 *
 * WEIGHT UPDATE (at segment boundaries, operators used at least once):
 * --------------------------------------------------------------------
 * w_i = max(MIN_WEIGHT, decay * w_i + (1 - decay) * theta_i / rho_i)
 *
 * Where:
 * - theta_i = total score accumulated by operator i in the segment
 * - rho_i = number of times operator i was used in the segment
 *
 * Operators unused in a segment keep their weight.
 */
public class AdaptiveOperatorSelection {

    public static final double MIN_WEIGHT = 0.01;

    // Below this total the roulette falls back to uniform selection
    private static final double ZERO_TOTAL = 1e-12;

    // Configuration parameters (from ALNSConfig)
    private final int SEGMENT_LENGTH;
    private final double DECAY;
    private final double SCORE_GLOBAL_BEST;
    private final double SCORE_IMPROVED;
    private final double SCORE_ACCEPTED;

    private final String[] names;
    private final double[] weights;

    // Score accumulators (reset at segment boundaries)
    private final double[] scores; // theta_i
    private final int[] uses;      // rho_i

    private int iterationCounter = 0;

    private final RandomSource random;

    /**
     * @param operators operator names, index i names operator i
     * @param random    random source shared with the driving engine
     * @param config    configuration holding rewards, segment length and decay
     */
    public AdaptiveOperatorSelection(String[] operators, RandomSource random, ALNSConfig config) {
        this.random = random;
        this.SEGMENT_LENGTH = config.getWeightUpdateInterval();
        this.DECAY = config.getDecay();
        this.SCORE_GLOBAL_BEST = config.getRewardBest();
        this.SCORE_IMPROVED = config.getRewardBetter();
        this.SCORE_ACCEPTED = config.getRewardAccepted();

        this.names = operators.clone();
        this.weights = new double[operators.length];
        this.scores = new double[operators.length];
        this.uses = new int[operators.length];
        Arrays.fill(weights, 1.0);
    }

    /**
     * Roulette wheel over the current weights.
     *
     * @return index of the selected operator
     */
    public int selectOperator() {
        int n = weights.length;
        double total = 0.0;
        for (double w : weights) {
            total += w;
        }

        if (total < ZERO_TOTAL) {
            return random.nextInt(0, n - 1);
        }

        double r = random.uniform() * total;
        double cumulative = 0.0;
        for (int i = 0; i < n; i++) {
            cumulative += weights[i];
            if (r < cumulative) {
                return i;
            }
        }

        // Floating point leftovers
        return n - 1;
    }

    /**
     * Map an outcome to its reward.
     */
    public double rewardFor(OperatorOutcome outcome) {
        switch (outcome) {
            case NewGlobalBest:
                return SCORE_GLOBAL_BEST;
            case Improved:
                return SCORE_IMPROVED;
            case Accepted:
                return SCORE_ACCEPTED;
            default:
                return 0.0;
        }
    }

    /**
     * Record the outcome of one application of {@code operator}; at a segment
     * boundary the weights are updated and the accumulators reset.
     */
    public void recordOutcome(int operator, OperatorOutcome outcome) {
        scores[operator] += rewardFor(outcome);
        uses[operator]++;

        iterationCounter++;

        if (SEGMENT_LENGTH > 0 && iterationCounter % SEGMENT_LENGTH == 0) {
            updateWeights();
            resetScores();
        }
    }

    /**
     * Blend each used operator's average segment score into its weight.
     */
    public void updateWeights() {
        for (int i = 0; i < weights.length; i++) {
            if (uses[i] == 0) {
                continue;
            }
            double avgScore = scores[i] / uses[i];
            double updated = DECAY * weights[i] + (1.0 - DECAY) * avgScore;
            weights[i] = Math.max(MIN_WEIGHT, updated);
        }
    }

    /**
     * Hard reset of scores and uses at a segment boundary.
     */
    public void resetScores() {
        Arrays.fill(scores, 0.0);
        Arrays.fill(uses, 0);
    }

    /**
     * Print current operator weights (for monitoring)
     *
     * @param iteration Current iteration number
     */
    public void printStats(int iteration) {
        double total = 0.0;
        for (double w : weights) {
            total += w;
        }
        System.out.printf("[AOS] iter:%d | Weights: ", iteration);
        for (int i = 0; i < weights.length; i++) {
            System.out.printf("%s:%.3f(%.1f%%) ", names[i], weights[i], 100.0 * weights[i] / total);
        }
        System.out.println();
    }

    /**
     * @return copy of the current weights
     */
    public double[] getWeights() {
        return weights.clone();
    }

    public double getScore(int operator) {
        return scores[operator];
    }

    public int getUses(int operator) {
        return uses[operator];
    }

    public int size() {
        return weights.length;
    }

    public String getName(int operator) {
        return names[operator];
    }

    public int getIterationCounter() {
        return iterationCounter;
    }
}
