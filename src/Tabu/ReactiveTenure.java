package Tabu;

/**
 * Reactive tenure controller (Battiti & Tecchiolli, 1994).
 *
 * Keeps the hashes chosen during the last {@code cycleWindow} iterations.
 * - Repeat inside the window (cycle): tenure += increase, capped at maxTenure
 * - {@code decreaseInterval} consecutive iterations without a repeat:
 *   tenure -= decrease, floored at minTenure
 *
 * The tenure always stays in [minTenure, maxTenure].
 */
public class ReactiveTenure {

    private final int minTenure;
    private final int maxTenure;
    private final int increase;
    private final int decrease;
    private final int decreaseInterval;

    // Circular window of recently chosen hashes
    private final long[] window;
    private int windowHead;
    private int windowCount;

    private int tenure;
    private int iterationsWithoutCycle;
    private int cyclesDetected;

    public ReactiveTenure(int initialTenure, int minTenure, int maxTenure,
                          int increase, int decrease, int cycleWindow, int decreaseInterval) {
        this.minTenure = minTenure;
        this.maxTenure = maxTenure;
        this.increase = increase;
        this.decrease = decrease;
        this.decreaseInterval = decreaseInterval;
        this.window = new long[Math.max(1, cycleWindow)];
        this.tenure = clamp(initialTenure);
    }

    private int clamp(int t) {
        return Math.max(minTenure, Math.min(maxTenure, t));
    }

    /**
     * Add a hash to the window without adjusting the tenure (initial solution).
     */
    public void remember(long hash) {
        int tail = (windowHead + windowCount) % window.length;
        window[tail] = hash;
        if (windowCount < window.length) {
            windowCount++;
        } else {
            windowHead = (windowHead + 1) % window.length;
        }
    }

    private boolean inWindow(long hash) {
        for (int i = 0; i < windowCount; i++) {
            if (window[(windowHead + i) % window.length] == hash) return true;
        }
        return false;
    }

    /**
     * Register the hash chosen this iteration and adapt the tenure.
     *
     * @return the new tenure
     */
    public int update(long chosenHash) {
        if (inWindow(chosenHash)) {
            cyclesDetected++;
            iterationsWithoutCycle = 0;
            tenure = clamp(tenure + increase);
        } else {
            iterationsWithoutCycle++;
            if (decreaseInterval > 0 && iterationsWithoutCycle >= decreaseInterval) {
                iterationsWithoutCycle = 0;
                tenure = clamp(tenure - decrease);
            }
        }
        remember(chosenHash);
        return tenure;
    }

    public int getTenure() {
        return tenure;
    }

    public int getCyclesDetected() {
        return cyclesDetected;
    }
}
