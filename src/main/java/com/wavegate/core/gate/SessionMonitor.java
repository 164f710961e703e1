package com.wavegate.core.gate;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session mutex plus a condition signalled whenever approval state changes.
 * <p>
 * Every read-modify-write of a session's durable approval state happens while holding
 * this lock. Waiting on the condition releases it.
 */
public final class SessionMonitor {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * Waits for a signal or until {@code timeout} elapses. Must be called while holding the lock.
     */
    public void awaitChange(Duration timeout) throws InterruptedException {
        changed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void signalAll() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
