package com.nayem.leasehold.core;

import com.nayem.leasehold.broker.BrokerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates {@link LeaseManager} instances that share one broker client, clock,
 * timer scheduler and metrics sink.
 * <p>
 * Timers only hand expiries off: the blocking abandon runs on a separate
 * expiry pool, so timer threads are always free to fire on time.
 * </p>
 */
public class LeaseManagerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LeaseManagerFactory.class);

    private final BrokerClient broker;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ExecutorService expiryExecutor;
    private final boolean ownsExpiryExecutor;
    private final LeaseMetrics metrics;
    private final Duration brokerTimeout;
    private final Duration shutdownTimeout;

    public LeaseManagerFactory(BrokerClient broker,
            Clock clock,
            ScheduledExecutorService scheduler,
            boolean ownsScheduler,
            ExecutorService expiryExecutor,
            boolean ownsExpiryExecutor,
            LeaseMetrics metrics,
            Duration brokerTimeout,
            Duration shutdownTimeout) {
        this.broker = broker;
        this.clock = clock;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.expiryExecutor = expiryExecutor;
        this.ownsExpiryExecutor = ownsExpiryExecutor;
        this.metrics = metrics;
        this.brokerTimeout = brokerTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Creates a lease whose explicit dispositions become no-ops once
     * {@code workSignal} is cancelled.
     *
     * @param message    the received message
     * @param workSignal signal shared with the code processing the message
     */
    public LeaseManager create(LeasedMessage message, CancellationSignal workSignal) {
        return create(message, workSignal, workSignal);
    }

    /**
     * @param message      the received message
     * @param workSignal   signal shared with the processing code, cancelled on
     *                     expiry
     * @param callerSignal signal that turns explicit dispositions into no-ops
     */
    public LeaseManager create(LeasedMessage message, CancellationSignal workSignal,
            CancellationSignal callerSignal) {
        return new LeaseManager(message, broker, clock, scheduler, expiryExecutor, workSignal, callerSignal,
                metrics, brokerTimeout);
    }

    public LeaseMetrics getMetrics() {
        return metrics;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            shutdown(scheduler, "Lease timer scheduler");
        }
        if (ownsExpiryExecutor) {
            shutdown(expiryExecutor, "Lease expiry executor");
        }
    }

    private void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not terminate in {}, forcing shutdown", name, shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link LeaseManagerFactory}.
     * <p>
     * Only the broker client is required. Without an explicit scheduler the
     * factory creates and owns one, shutting it down on {@link #close()}.
     * </p>
     */
    public static class Builder {
        private BrokerClient broker;
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService scheduler;
        private ExecutorService expiryExecutor;
        private int schedulerThreads = 1;
        private String threadNamePrefix = "leasehold-timer-";
        private LeaseMetrics metrics;
        private Duration brokerTimeout = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        /**
         * Sets the client that receives the terminal calls.
         *
         * @param broker the broker client
         * @return this builder
         */
        public Builder broker(BrokerClient broker) {
            this.broker = broker;
            return this;
        }

        /**
         * Sets the clock used to measure the time left on a lock.
         * <p>
         * Default is {@link Clock#systemUTC()}.
         * </p>
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Uses an externally managed scheduler for expiry timers. The factory will
         * not shut it down.
         *
         * @param scheduler the scheduler
         * @return this builder
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Uses an externally managed executor for expiry abandons. The factory
         * will not shut it down. By default the factory creates a cached pool of
         * daemon threads, one per concurrently expiring lease.
         *
         * @param executor the expiry executor
         * @return this builder
         */
        public Builder expiryExecutor(ExecutorService executor) {
            this.expiryExecutor = executor;
            return this;
        }

        /**
         * Sets the thread count of the scheduler the factory creates itself.
         * Ignored when {@link #scheduler(ScheduledExecutorService)} is set.
         *
         * @param threads number of timer threads
         * @return this builder
         */
        public Builder schedulerThreads(int threads) {
            this.schedulerThreads = threads;
            return this;
        }

        /**
         * Sets the name prefix of timer threads. Default is "leasehold-timer-".
         * Expiry threads get the same prefix followed by "expiry-".
         *
         * @param prefix the thread name prefix
         * @return this builder
         */
        public Builder threadNamePrefix(String prefix) {
            this.threadNamePrefix = prefix;
            return this;
        }

        public Builder metrics(LeaseMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets how long a disposition waits for the broker before giving up.
         * Null waits indefinitely. Default is 30 seconds.
         *
         * @param timeout the broker call timeout
         * @return this builder
         */
        public Builder brokerTimeout(Duration timeout) {
            this.brokerTimeout = timeout;
            return this;
        }

        public Builder shutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        /**
         * @return the configured factory
         * @throws IllegalStateException if no broker client was set
         */
        public LeaseManagerFactory build() {
            if (broker == null) {
                throw new IllegalStateException("BrokerClient is required.");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required.");
            }

            boolean ownedScheduler = scheduler == null;
            ScheduledExecutorService timers = ownedScheduler ? newScheduler() : scheduler;
            boolean ownedExpiry = expiryExecutor == null;
            ExecutorService expiries = ownedExpiry
                    ? Executors.newCachedThreadPool(daemonThreads(threadNamePrefix + "expiry-"))
                    : expiryExecutor;

            return new LeaseManagerFactory(broker, clock, timers, ownedScheduler, expiries, ownedExpiry,
                    metrics != null ? metrics : LeaseMetrics.noOp(), brokerTimeout, shutdownTimeout);
        }

        private ScheduledExecutorService newScheduler() {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                    Math.max(1, schedulerThreads), daemonThreads(threadNamePrefix));
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }

        private static ThreadFactory daemonThreads(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
