package Tabu;

import java.util.HashMap;
import java.util.Map;

/**
 * Long-term memory: how many times each solution hash was chosen as the
 * incumbent. Counts only grow until {@link #reset()}.
 */
public class FrequencyMemory {

    private final Map<Long, Integer> frequencies = new HashMap<>();

    public int get(long hash) {
        return frequencies.getOrDefault(hash, 0);
    }

    public void increment(long hash) {
        frequencies.merge(hash, 1, Integer::sum);
    }

    public void reset() {
        frequencies.clear();
    }

    public int size() {
        return frequencies.size();
    }
}
