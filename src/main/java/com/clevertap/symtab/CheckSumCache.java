package com.clevertap.symtab;

import com.clevertap.symtab.utils.CheckSummer;
import java.util.Map.Entry;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily computed digests of a {@link SymbolStore}.
 * <p>
 * Readers share the read lock while the cached digests are valid. The first reader after an
 * invalidation takes the write lock and recomputes both digests, unless another reader got there
 * first.
 */
class CheckSumCache {

    private static final Logger LOG = LoggerFactory.getLogger(CheckSumCache.class);

    private static final byte SYMBOL_SEPARATOR = 0;

    private final SymbolStore store;
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

    // Guarded by rwLock.
    private boolean valid = false;
    private String checkSum;
    private String labeledCheckSum;

    CheckSumCache(final SymbolStore store) {
        this.store = store;
    }

    void invalidate() {
        rwLock.writeLock().lock();
        try {
            valid = false;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    String checkSum() {
        rwLock.readLock().lock();
        try {
            if (valid) {
                return checkSum;
            }
        } finally {
            rwLock.readLock().unlock();
        }
        recompute();
        rwLock.readLock().lock();
        try {
            return checkSum;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    String labeledCheckSum() {
        rwLock.readLock().lock();
        try {
            if (valid) {
                return labeledCheckSum;
            }
        } finally {
            rwLock.readLock().unlock();
        }
        recompute();
        rwLock.readLock().lock();
        try {
            return labeledCheckSum;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private void recompute() {
        rwLock.writeLock().lock();
        try {
            if (valid) {
                return;
            }
            LOG.debug("Computing checksums for {} symbols", store.size());

            final CheckSummer content = new CheckSummer();
            for (int i = 0; i < store.size(); i++) {
                content.update(store.symbolAt(i)).update(SYMBOL_SEPARATOR);
            }

            final CheckSummer labeled = new CheckSummer();
            final int denseLimit = store.denseLimit();
            for (int i = 0; i < denseLimit; i++) {
                labeled.update(store.symbolAt(i) + '\t' + i);
            }
            for (Entry<Long, Integer> entry : store.sparseEntries().entrySet()) {
                // Keys below the dense limit (negative keys) have never been part of this
                // digest. Persisted digests depend on that.
                if (entry.getKey() < denseLimit) {
                    continue;
                }
                labeled.update(store.symbolAt(entry.getValue()) + '\t' + entry.getKey());
            }

            checkSum = content.digest();
            labeledCheckSum = labeled.digest();
            valid = true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    boolean isValid() {
        rwLock.readLock().lock();
        try {
            return valid;
        } finally {
            rwLock.readLock().unlock();
        }
    }
}
