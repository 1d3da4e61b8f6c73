package com.clevertap.symtab.index;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Open addressing string interning index.
 * <p>
 * Every unique symbol gets a storage position, which is its 0-based rank in insertion order.
 * Buckets hold storage positions and are probed linearly. The bucket array always has a power of
 * two length and doubles once it is 75% occupied.
 * <p>
 * Notes:
 * <ul>
 *     <li>{@link #find(String)} never resizes, so concurrent readers are safe as long as no writer
 *     is active</li>
 *     <li>Removal erases the symbol from the backing array and rebuilds all buckets. There are no
 *     tombstones, hence lookup cost does not degrade over time</li>
 * </ul>
 */
public class SymbolIndex {

    public static final int NOT_FOUND = -1;

    static final int DEFAULT_BUCKET_COUNT = 1 << 4;
    private static final float MAX_OCCUPANCY_RATIO = 0.75f;
    private static final int EMPTY_BUCKET = -1;

    private final ArrayList<String> symbols;
    private int[] buckets;
    private int hashMask;

    public SymbolIndex() {
        this(DEFAULT_BUCKET_COUNT);
    }

    /**
     * @param bucketCount The initial number of buckets, rounded up to a power of two
     */
    public SymbolIndex(int bucketCount) {
        if (bucketCount < 0) {
            throw new IllegalArgumentException("Bucket count cannot be negative: " + bucketCount);
        }
        int cap = 2;
        if (bucketCount > 2) {
            cap = 1 << (32 - Integer.numberOfLeadingZeros(bucketCount - 1));
        }
        symbols = new ArrayList<>();
        buckets = new int[cap];
        Arrays.fill(buckets, EMPTY_BUCKET);
        hashMask = cap - 1;
    }

    private SymbolIndex(ArrayList<String> symbols, int[] buckets) {
        this.symbols = symbols;
        this.buckets = buckets;
        this.hashMask = buckets.length - 1;
    }

    /**
     * Inserts the symbol, unless it is already present.
     *
     * @return The new storage position if the symbol was inserted, or
     * {@code -(existingPosition + 1)} if it was already present
     */
    public int insertOrFind(String symbol) {
        if (symbols.size() >= MAX_OCCUPANCY_RATIO * buckets.length) {
            rehash(buckets.length * 2);
        }
        int idx = bucketOf(symbol);
        while (buckets[idx] != EMPTY_BUCKET) {
            final int stored = buckets[idx];
            if (symbols.get(stored).equals(symbol)) {
                return -(stored + 1);
            }
            idx = (idx + 1) & hashMask;
        }
        final int next = symbols.size();
        buckets[idx] = next;
        symbols.add(symbol);
        return next;
    }

    /**
     * @return The storage position of the symbol, or {@link #NOT_FOUND}
     */
    public int find(String symbol) {
        int idx = bucketOf(symbol);
        while (buckets[idx] != EMPTY_BUCKET) {
            final int stored = buckets[idx];
            if (symbols.get(stored).equals(symbol)) {
                return stored;
            }
            idx = (idx + 1) & hashMask;
        }
        return NOT_FOUND;
    }

    public String symbolAt(int position) {
        return symbols.get(position);
    }

    public int size() {
        return symbols.size();
    }

    int bucketCount() {
        return buckets.length;
    }

    /**
     * Removes the symbol at the given position. Every later symbol moves down by one position.
     */
    public void removeAt(int position) {
        symbols.remove(position);
        rehash(buckets.length);
    }

    public void shrinkToFit() {
        symbols.trimToSize();
    }

    public SymbolIndex copy() {
        return new SymbolIndex(new ArrayList<>(symbols), buckets.clone());
    }

    private void rehash(int bucketCount) {
        if (buckets.length != bucketCount) {
            buckets = new int[bucketCount];
            hashMask = bucketCount - 1;
        }
        Arrays.fill(buckets, EMPTY_BUCKET);
        for (int i = 0; i < symbols.size(); i++) {
            int idx = bucketOf(symbols.get(i));
            while (buckets[idx] != EMPTY_BUCKET) {
                idx = (idx + 1) & hashMask;
            }
            buckets[idx] = i;
        }
    }

    private int bucketOf(String symbol) {
        final int h = symbol.hashCode();
        return (h ^ (h >>> 16)) & hashMask;
    }
}
