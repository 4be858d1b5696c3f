package Tabu;

import Solution.Solution;

/**
 * Built-in {@link SolutionHash} implementations, all FNV-1a based.
 */
public final class SolutionHashes {

    static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    static final long FNV_PRIME = 0x100000001b3L;

    private SolutionHashes() {
    }

    /**
     * Byte-wise FNV-1a over the whole buffer. Default tabu hash.
     */
    public static long hashBytes(Solution solution) {
        byte[] bytes = solution.getData();
        long hash = FNV_OFFSET_BASIS;
        for (byte b : bytes) {
            hash ^= (b & 0xFF);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /**
     * FNV-1a over the int elements of the buffer.
     */
    public static long hashInts(Solution solution) {
        long hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < solution.getSize(); i++) {
            hash ^= (solution.getInt(i) & 0xFFFFFFFFL);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /**
     * FNV-1a over the double elements discretised to 1e-4, so nearly equal
     * continuous points share a hash.
     */
    public static long hashDoubles(Solution solution) {
        long hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < solution.getSize(); i++) {
            long discretized = (long) (solution.getDouble(i) * 10000.0);
            hash ^= discretized;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /**
     * Hash of a cyclic tour (int permutation) that ignores where the tour starts
     * and which way it is walked: the sequence is read from its smallest city
     * towards the smaller of that city's two tour neighbours.
     */
    public static long hashTour(Solution solution) {
        int n = solution.getSize();
        int start = 0;
        for (int i = 1; i < n; i++) {
            if (solution.getInt(i) < solution.getInt(start)) start = i;
        }

        int next = solution.getInt((start + 1) % n);
        int prev = solution.getInt((start - 1 + n) % n);
        int step = (n > 2 && prev < next) ? -1 : 1;

        long hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < n; i++) {
            int idx = ((start + step * i) % n + n) % n;
            hash ^= (solution.getInt(idx) & 0xFFFFFFFFL);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
