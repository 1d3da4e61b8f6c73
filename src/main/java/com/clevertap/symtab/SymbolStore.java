package com.clevertap.symtab;

import com.clevertap.symtab.entities.SymbolEntry;
import com.clevertap.symtab.exceptions.DuplicateKeyException;
import com.clevertap.symtab.exceptions.ReadOnlySymbolTableException;
import com.clevertap.symtab.exceptions.SymbolTableRuntimeException;
import com.clevertap.symtab.index.SymbolIndex;
import gnu.trove.list.array.TLongArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NoSuchElementException;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backing store of a symbol table: the interning index plus the key to position mapping.
 * <p>
 * Keys in the dense range {@code [0, denseLimit)} are their own storage position. Every other key
 * lives in the sparse map (key to position), whose inverse is kept in {@link #sparseKeys}: the key
 * of storage position {@code denseLimit + i} is {@code sparseKeys.get(i)}.
 * <p>
 * Invariants, restored by every mutation:
 * <ul>
 *     <li>{@code denseLimit <= index.size()}</li>
 *     <li>{@code sparse.size() == sparseKeys.size() == index.size() - denseLimit}</li>
 *     <li>every sparse key is negative or {@code >= denseLimit}</li>
 *     <li>a key maps to exactly one position and a position to exactly one key</li>
 * </ul>
 * <p>
 * A store is not synchronized. It supports one writer, or any number of readers while no writer is
 * active. Once {@link #freeze() frozen} it rejects every mutation.
 */
public class SymbolStore {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolStore.class);

    private String name;
    private long availableKey;
    private int denseLimit;
    private final SymbolIndex index;
    private final TreeMap<Long, Integer> sparse;
    private final TLongArrayList sparseKeys;
    private volatile boolean frozen;

    public SymbolStore() {
        this("");
    }

    public SymbolStore(String name) {
        this(name, new SymbolIndex(), new TreeMap<>(), new TLongArrayList(), 0, 0);
    }

    private SymbolStore(String name, SymbolIndex index, TreeMap<Long, Integer> sparse,
            TLongArrayList sparseKeys, int denseLimit, long availableKey) {
        this.name = name == null ? "" : name;
        this.index = index;
        this.sparse = sparse;
        this.sparseKeys = sparseKeys;
        this.denseLimit = denseLimit;
        this.availableKey = availableKey;
    }

    /**
     * Adds the symbol under the given key.
     * <p>
     * If the symbol is already present, its existing key is returned and the requested key is
     * ignored. Adding under {@link SymbolTable#NO_SYMBOL} is a no-op.
     *
     * @return The key the symbol is stored under
     * @throws DuplicateKeyException If the key is already bound to a different symbol
     */
    public long addSymbol(String symbol, long key) {
        if (key == SymbolTable.NO_SYMBOL) {
            return SymbolTable.NO_SYMBOL;
        }
        checkWritable();

        final int existing = index.find(symbol);
        if (existing != SymbolIndex.NOT_FOUND) {
            final long keyAlready = getNthKey(existing);
            if (keyAlready != key) {
                LOG.debug("Symbol {} already present with key {}, ignoring the new key {}",
                        symbol, keyAlready, key);
            }
            return keyAlready;
        }

        final String bound = find(key);
        if (bound != null) {
            throw new DuplicateKeyException(key, bound);
        }

        final int position = index.insertOrFind(symbol);
        if (position == denseLimit && key == denseLimit) {
            denseLimit++;
        } else {
            sparse.put(key, position);
            sparseKeys.add(key);
        }
        if (key >= availableKey) {
            // Saturates at Long.MAX_VALUE, which is then itself bound.
            availableKey = key == Long.MAX_VALUE ? key : key + 1;
        }
        return key;
    }

    /**
     * Adds the symbol under {@link #availableKey()}, unless it is already present.
     *
     * @throws SymbolTableRuntimeException If {@link Long#MAX_VALUE} is bound, leaving no key to assign
     */
    public long addSymbol(String symbol) {
        if (availableKey == Long.MAX_VALUE && index.find(symbol) == SymbolIndex.NOT_FOUND
                && find(availableKey) != null) {
            throw new SymbolTableRuntimeException(
                    "No key left to assign to \"" + symbol + "\" in the table " + name);
        }
        return addSymbol(symbol, availableKey);
    }

    /**
     * Removes the symbol stored under the given key.
     * <p>
     * Removing a dense key shrinks the dense range to {@code [0, key)}. The dense keys above it
     * lose their identity position and move to the sparse map.
     *
     * @return true if a symbol was removed, false if the key was absent
     */
    public boolean removeSymbol(long key) {
        checkWritable();

        final boolean dense = key >= 0 && key < denseLimit;
        final int position;
        if (dense) {
            position = (int) key;
        } else {
            final Integer sparsePosition = sparse.get(key);
            if (sparsePosition == null) {
                LOG.debug("Key {} not found, nothing to remove", key);
                return false;
            }
            position = sparsePosition;
        }

        index.removeAt(position);

        if (!dense) {
            sparse.remove(key);
            sparseKeys.removeAt(position - denseLimit);
        }

        // Every later position moved down by one.
        for (Entry<Long, Integer> entry : sparse.entrySet()) {
            if (entry.getValue() > position) {
                entry.setValue(entry.getValue() - 1);
            }
        }

        if (dense) {
            final int oldLimit = denseLimit;
            final int newLimit = (int) key;
            final long[] migrated = new long[oldLimit - newLimit - 1];
            for (int i = 0; i < migrated.length; i++) {
                final long migratedKey = newLimit + 1 + i;
                migrated[i] = migratedKey;
                sparse.put(migratedKey, (int) migratedKey - 1);
            }
            sparseKeys.insert(0, migrated);
            denseLimit = newLimit;
        }

        if (key == availableKey - 1 && find(availableKey) == null) {
            availableKey = key;
        }
        return true;
    }

    /**
     * @return The symbol, or null if the key is absent
     */
    public String find(long key) {
        final int position;
        if (key >= 0 && key < denseLimit) {
            position = (int) key;
        } else {
            final Integer sparsePosition = sparse.get(key);
            if (sparsePosition == null) {
                return null; // NOSONAR - null signals absence.
            }
            position = sparsePosition;
        }
        if (position >= index.size()) {
            return null;
        }
        return index.symbolAt(position);
    }

    /**
     * @return The key of the symbol, or {@link SymbolTable#NO_SYMBOL}
     */
    public long find(String symbol) {
        final int position = index.find(symbol);
        if (position == SymbolIndex.NOT_FOUND) {
            return SymbolTable.NO_SYMBOL;
        }
        return getNthKey(position);
    }

    /**
     * @return The key at the given storage position, or {@link SymbolTable#NO_SYMBOL}
     */
    public long getNthKey(int position) {
        if (position < 0 || position >= index.size()) {
            return SymbolTable.NO_SYMBOL;
        }
        if (position < denseLimit) {
            return position;
        }
        return sparseKeys.get(position - denseLimit);
    }

    public String symbolAt(int position) {
        return index.symbolAt(position);
    }

    public int size() {
        return index.size();
    }

    public int denseLimit() {
        return denseLimit;
    }

    /**
     * @return A read only view of the sparse map, ascending by key
     */
    public SortedMap<Long, Integer> sparseEntries() {
        return Collections.unmodifiableSortedMap(sparse);
    }

    public long availableKey() {
        return availableKey;
    }

    void setAvailableKey(long availableKey) {
        checkWritable();
        this.availableKey = availableKey;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        checkWritable();
        this.name = name == null ? "" : name;
    }

    public void shrinkToFit() {
        index.shrinkToFit();
        sparseKeys.trimToSize();
    }

    /**
     * Makes this store permanently read only.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * @return A deep, writable copy of this store
     */
    public SymbolStore copy() {
        return new SymbolStore(name, index.copy(), new TreeMap<>(sparse),
                new TLongArrayList(sparseKeys), denseLimit, availableKey);
    }

    /**
     * Iterates all entries in ascending key order: negative keys, then the dense range, then the
     * remaining sparse keys.
     */
    public Iterator<SymbolEntry> iterator() {
        final Iterator<Entry<Long, Integer>> negative = sparse.headMap(0L).entrySet().iterator();
        final Iterator<Entry<Long, Integer>> positive = sparse.tailMap(0L).entrySet().iterator();
        final int limit = denseLimit;

        return new Iterator<SymbolEntry>() {
            int nextDense = 0;

            @Override
            public boolean hasNext() {
                return negative.hasNext() || nextDense < limit || positive.hasNext();
            }

            @Override
            public SymbolEntry next() {
                if (negative.hasNext()) {
                    return toEntry(negative.next());
                }
                if (nextDense < limit) {
                    final int key = nextDense++;
                    return new SymbolEntry(index.symbolAt(key), key);
                }
                if (positive.hasNext()) {
                    return toEntry(positive.next());
                }
                throw new NoSuchElementException();
            }
        };
    }

    private SymbolEntry toEntry(Map.Entry<Long, Integer> entry) {
        return new SymbolEntry(index.symbolAt(entry.getValue()), entry.getKey());
    }

    private void checkWritable() {
        if (frozen) {
            throw new ReadOnlySymbolTableException(name);
        }
    }
}
