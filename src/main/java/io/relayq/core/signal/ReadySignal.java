package io.relayq.core.signal;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Binary set/clear signal used to wake the delivery task waiting on a client.
 * <p>
 * A {@link #set()} releases every waiter whose observed generation predates it, even if
 * {@link #clear()} runs before the waiter re-acquires the lock or before it starts waiting at all.
 * </p>
 */
public final class ReadySignal {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition condition = lock.newCondition();

    private boolean set;
    private long generation;

    /** Raises the signal and wakes waiters. */
    public void set() {
        lock.lock();
        try {
            set = true;
            generation++;
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Resets the signal. */
    public void clear() {
        lock.lock();
        try {
            set = false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isSet() {
        lock.lock();
        try {
            return set;
        } finally {
            lock.unlock();
        }
    }

    boolean hasWaiters() {
        lock.lock();
        try {
            return lock.hasWaiters(condition);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current generation. A waiter that captures it before its wake-up condition can occur and
     * passes it to {@link #await(long)} cannot miss a {@link #set()} that happens in between.
     */
    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the signal is raised, or until it has been raised at least once since
     * {@code observed} was read from {@link #generation()}.
     */
    public void await(final long observed) throws InterruptedException {
        lock.lock();
        try {
            while (!set && generation == observed) {
                condition.await();
            }
        } finally {
            lock.unlock();
        }
    }
}
