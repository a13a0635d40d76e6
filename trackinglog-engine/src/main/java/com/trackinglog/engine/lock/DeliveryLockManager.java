package com.trackinglog.engine.lock;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per delivery id.
 * Every read-validate-mutate sequence on a delivery runs under its lock, so callers
 * acting on the same id observe a single total order. Distinct ids never contend.
 *
 * Locks are reentrant: a locked operation may call another locked operation on the same id.
 * An entry lives only while some thread holds or waits for it, so ids that are never
 * touched again (unknown ids, finished reads) leave nothing behind.
 */
@Component
public class DeliveryLockManager {

    private final Map<Long, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Run an action while holding the lock for a delivery.
     */
    public <T> T withLock(long deliveryId, Supplier<T> action) {
        LockEntry entry = acquire(deliveryId);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(deliveryId);
        }
    }

    /**
     * Run an action without a result while holding the lock for a delivery.
     */
    public void runWithLock(long deliveryId, Runnable action) {
        withLock(deliveryId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Check if the current thread holds the lock for a delivery.
     */
    public boolean isHeldByCurrentThread(long deliveryId) {
        LockEntry entry = locks.get(deliveryId);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    /**
     * Number of delivery ids with a live lock entry.
     */
    public int activeLocks() {
        return locks.size();
    }

    // Reference counts change only inside compute, which is atomic per key

    private LockEntry acquire(long deliveryId) {
        return locks.compute(deliveryId, (id, existing) -> {
            LockEntry entry = existing != null ? existing : new LockEntry();
            entry.users++;
            return entry;
        });
    }

    private void release(long deliveryId) {
        locks.computeIfPresent(deliveryId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
