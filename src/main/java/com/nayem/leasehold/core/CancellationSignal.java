package com.nayem.leasehold.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation handle shared between the code processing a message
 * and the {@link LeaseManager} guarding its lease.
 * <p>
 * Processing code polls {@link #isCancellationRequested()} or blocks in
 * {@link #await(Duration)}. Cancellation is one-way: once requested it stays
 * requested, and registered callbacks run exactly once.
 * </p>
 */
public class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private static final CancellationSignal NONE = new CancellationSignal() {
        @Override
        public void cancel() {
            // never cancelled
        }

        @Override
        public void onCancel(Runnable callback) {
            // callbacks would never run
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Returns a shared signal that is never cancelled. {@link #cancel()} on it
     * does nothing.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    /**
     * Requests cancellation. Only the first call has an effect.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Blocks until cancellation is requested or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return true if cancellation was requested
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a callback to run when cancellation is requested. Runs it on the
     * calling thread if cancellation was already requested.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        // cancel() may have iterated before the add landed; the remove decides who runs it
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Work was cancelled");
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Cancellation callback failed", e);
        }
    }

    @Override
    public String toString() {
        return "CancellationSignal[cancelled=" + cancelled.get() + "]";
    }
}
