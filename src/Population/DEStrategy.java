package Population;

/**
 * Donor vector construction of differential evolution (r1..r5 distinct, never the target i).
 */
public enum DEStrategy {
    /** x_r1 + F (x_r2 - x_r3) */
    Rand1(3),
    /** x_best + F (x_r1 - x_r2) */
    Best1(2),
    /** x_i + F (x_best - x_i) + F (x_r1 - x_r2) */
    CurrentToBest1(2),
    /** x_r1 + F (x_r2 - x_r3) + F (x_r4 - x_r5) */
    Rand2(5),
    /** x_best + F (x_r1 - x_r2) + F (x_r3 - x_r4) */
    Best2(4);

    private final int randomVectors;

    DEStrategy(int randomVectors) {
        this.randomVectors = randomVectors;
    }

    /**
     * Distinct random population members the donor needs besides the target.
     */
    public int getRandomVectors() {
        return randomVectors;
    }
}
