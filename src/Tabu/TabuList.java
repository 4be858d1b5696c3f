package Tabu;

import java.util.ArrayList;
import java.util.List;

/**
 * Recency memory: bounded FIFO of (hash, insertion iteration).
 *
 * The tenure is a hard cap on the number of entries. Adding beyond it, or
 * lowering it, evicts the oldest entries first. Storage is a circular buffer
 * sized for the largest tenure the list can ever be given, so the search loop
 * never allocates.
 *
 * Lookups are linear scans; tenures are small (tens of entries).
 */
public class TabuList {

    private final long[] hashes;
    private final int[] iterations;
    private int head;   // index of the oldest entry
    private int count;
    private int tenure;

    /**
     * @param tenure      initial tenure (>= 1)
     * @param maxCapacity largest tenure this list will be given
     */
    public TabuList(int tenure, int maxCapacity) {
        int capacity = Math.max(1, Math.max(tenure, maxCapacity));
        this.hashes = new long[capacity];
        this.iterations = new int[capacity];
        this.head = 0;
        this.count = 0;
        this.tenure = clampTenure(tenure);
    }

    private int clampTenure(int t) {
        return Math.max(1, Math.min(t, hashes.length));
    }

    public void add(long hash, int iteration) {
        if (count == hashes.length) {
            evictOldest();
        }
        int tail = (head + count) % hashes.length;
        hashes[tail] = hash;
        iterations[tail] = iteration;
        count++;
        while (count > tenure) {
            evictOldest();
        }
    }

    private void evictOldest() {
        head = (head + 1) % hashes.length;
        count--;
    }

    /**
     * Change the tenure, evicting the oldest entries while the list is longer.
     */
    public void setTenure(int newTenure) {
        tenure = clampTenure(newTenure);
        while (count > tenure) {
            evictOldest();
        }
    }

    public boolean contains(long hash) {
        for (int i = 0; i < count; i++) {
            if (hashes[(head + i) % hashes.length] == hash) return true;
        }
        return false;
    }

    /**
     * @return most recent insertion iteration of {@code hash}, or
     *         {@code Integer.MIN_VALUE} when it is not tabu
     */
    public int insertionIteration(long hash) {
        for (int i = count - 1; i >= 0; i--) {
            int idx = (head + i) % hashes.length;
            if (hashes[idx] == hash) return iterations[idx];
        }
        return Integer.MIN_VALUE;
    }

    public void clear() {
        head = 0;
        count = 0;
    }

    public int size() {
        return count;
    }

    public int getTenure() {
        return tenure;
    }

    public int getCapacity() {
        return hashes.length;
    }

    /**
     * Snapshot of the entries, oldest first.
     */
    public List<TabuEntry> entries() {
        List<TabuEntry> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int idx = (head + i) % hashes.length;
            list.add(new TabuEntry(hashes[idx], iterations[idx]));
        }
        return list;
    }
}
