package io.mnemo.core.store;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-record mutual exclusion. Interactive writers queue with {@link #withLock};
 * background work uses {@link #tryWithLock} and skips whatever is busy.
 */
public final class RecordLockManager {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public static String memoryKey(long memoryId) {
        return "memory:" + memoryId;
    }

    public static String sessionKey(long sessionId) {
        return "session:" + sessionId;
    }

    public static String conversationKey(String conversationId) {
        return "conversation:" + conversationId;
    }

    public <T, E extends Exception> T withLock(String key, LockedWork<T, E> work) throws E {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return work.run();
        } finally {
            lock.unlock();
        }
    }

    public <T, E extends Exception> T withInterruptibleLock(String key, LockedWork<T, E> work)
        throws E, InterruptedException {
        ReentrantLock lock = lockFor(key);
        lock.lockInterruptibly();
        try {
            return work.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code work} only if the lock is free right now.
     *
     * @return true when the work ran
     */
    public <E extends Exception> boolean tryWithLock(String key, LockedAction<E> work) throws E {
        ReentrantLock lock = lockFor(key);
        if (!lock.tryLock()) {
            return false;
        }
        try {
            work.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }

    private ReentrantLock lockFor(String key) {
        return locks.computeIfAbsent(key, ignored -> new ReentrantLock());
    }

    @FunctionalInterface
    public interface LockedWork<T, E extends Exception> {
        T run() throws E;
    }

    @FunctionalInterface
    public interface LockedAction<E extends Exception> {
        void run() throws E;
    }
}
