package org.Aayush.delivery.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Exclusive per-batch locks for operations that move stops between routes.
 *
 * <p>Multiple batches are always locked in ascending key order so that two
 * callers locking overlapping batch sets cannot deadlock. Routes without a
 * batch share one lock.</p>
 */
public final class BatchLockRegistry {
    static final String UNBATCHED_KEY = "";

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} while holding one batch's lock. A null batch id uses the shared lock.
     */
    public <T> T withBatchLock(String batchId, Supplier<T> action) {
        return withBatchLocks(List.of(key(batchId)), action);
    }

    /**
     * Runs {@code action} while holding every listed batch lock, acquired in ascending key order.
     *
     * @param batchIds batches to lock; duplicates are ignored.
     * @param action work to run once all locks are held.
     * @return the action's result.
     */
    public <T> T withBatchLocks(Collection<String> batchIds, Supplier<T> action) {
        TreeSet<String> ordered = new TreeSet<>();
        for (String batchId : batchIds) {
            ordered.add(key(batchId));
        }
        List<ReentrantLock> acquired = new ArrayList<>(ordered.size());
        try {
            for (String batchKey : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(batchKey, ignored -> new ReentrantLock());
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    boolean isHeldByCurrentThread(String batchId) {
        ReentrantLock lock = locks.get(key(batchId));
        return lock != null && lock.isHeldByCurrentThread();
    }

    private static String key(String batchId) {
        return batchId == null ? UNBATCHED_KEY : batchId;
    }
}
