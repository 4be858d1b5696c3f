package Auxiliary;

import java.util.Random;

/**
 * Seeded random number source threaded through every engine and strategy call.
 *
 * Each engine owns one instance and reseeds it once at the start of a run, so
 * two runs with the same configuration and seed draw exactly the same sequence.
 * Nothing here is static: independent engines never share state.
 *
 * Draws:
 * - uniform():        double in [0, 1)
 * - nextInt(min,max): integer in [min, max] (inclusive)
 * - gaussian():       N(0,1) via the polar Box-Muller method (the spare deviate
 *                     is cached and discarded on reseed)
 */
public class RandomSource {

    private final Random random;
    private long seed;

    private boolean hasSpare = false;
    private double spare;

    public RandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Restart the sequence. Clears the cached gaussian spare so the stream
     * after a reseed is identical to the stream of a fresh instance.
     */
    public void setSeed(long seed) {
        this.seed = seed;
        this.random.setSeed(seed);
        this.hasSpare = false;
    }

    public long getSeed() {
        return seed;
    }

    public double uniform() {
        return random.nextDouble();
    }

    /**
     * @return uniform integer in [min, max]; min when the range is empty
     */
    public int nextInt(int min, int max) {
        if (min >= max) return min;
        return min + random.nextInt(max - min + 1);
    }

    public double gaussian() {
        if (hasSpare) {
            hasSpare = false;
            return spare;
        }

        double u, v, s;
        do {
            u = uniform() * 2.0 - 1.0;
            v = uniform() * 2.0 - 1.0;
            s = u * u + v * v;
        } while (s >= 1.0 || s == 0.0);

        double mul = Math.sqrt(-2.0 * Math.log(s) / s);
        spare = v * mul;
        hasSpare = true;
        return u * mul;
    }

    /**
     * Fisher-Yates shuffle of the first {@code length} entries.
     */
    public void shuffle(int[] values, int length) {
        for (int i = length - 1; i > 0; i--) {
            int j = nextInt(0, i);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
