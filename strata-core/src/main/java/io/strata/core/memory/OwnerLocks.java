package io.strata.core.memory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-owner read/write locks. Mutations for one owner are serialized; different owners never
 * contend. In fail-fast mode a contended mutation throws {@link OwnerBusyException} instead of
 * waiting.
 */
public final class OwnerLocks {
    private final boolean failFast;
    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public OwnerLocks(boolean failFast) {
        this.failFast = failFast;
    }

    public <T> T write(String ownerId, LockedAction<T> action) throws IOException {
        Lock lock = lockFor(ownerId).writeLock();
        if (failFast) {
            if (!lock.tryLock()) {
                throw new OwnerBusyException(ownerId);
            }
        } else {
            lock.lock();
        }
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    public <T> T read(String ownerId, LockedAction<T> action) throws IOException {
        Lock lock = lockFor(ownerId).readLock();
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean failFast() {
        return failFast;
    }

    private ReentrantReadWriteLock lockFor(String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        return locks.computeIfAbsent(ownerId, ignored -> new ReentrantReadWriteLock());
    }

    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }
}
