package com.nayem.leasehold.worker;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nayem.leasehold.core.CancellationSignal;
import com.nayem.leasehold.core.LeaseManager;
import com.nayem.leasehold.core.LeaseManagerFactory;
import com.nayem.leasehold.core.LeasedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link MessageHandler} for each received message under a
 * {@link LeaseManager}.
 * <p>
 * For every message: create the lease, initialize it, run the handler, then
 * complete, dead-letter or abandon depending on the outcome. The lease is always
 * closed afterwards, so a message is never left locked.
 * </p>
 * <p>
 * At most {@code maxConcurrentCalls} messages are processed at once; further
 * submissions fail fast with {@link RejectedExecutionException}.
 * </p>
 */
public class LeasedMessageProcessor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LeasedMessageProcessor.class);

    private final LeaseManagerFactory leaseFactory;
    private final MessageHandler handler;
    private final ExecutorService executor;
    private final Semaphore permits;
    private final int maxConcurrentCalls;
    private final Duration callbackTimeout;
    private final Duration shutdownTimeout;
    // keyed by message id
    private final Cache<String, InFlight> inFlight;
    private volatile boolean shuttingDown;

    public LeasedMessageProcessor(LeaseManagerFactory leaseFactory,
            MessageHandler handler,
            ExecutorService executor,
            int maxConcurrentCalls,
            Duration callbackTimeout,
            Duration inFlightRetention,
            Duration shutdownTimeout) {
        this.leaseFactory = leaseFactory;
        this.handler = handler;
        this.executor = executor;
        this.maxConcurrentCalls = maxConcurrentCalls;
        this.permits = new Semaphore(maxConcurrentCalls);
        this.callbackTimeout = callbackTimeout;
        this.shutdownTimeout = shutdownTimeout;
        this.inFlight = Caffeine.newBuilder()
                .expireAfterWrite(inFlightRetention)
                .build();
    }

    /**
     * Processes a received message asynchronously.
     *
     * @param message the message, with its lock already obtained
     * @return a future completed once the message has been disposed; it fails
     *         only if the message was not accepted
     */
    public CompletableFuture<Void> process(LeasedMessage message) {
        if (shuttingDown) {
            return CompletableFuture.failedFuture(
                    new RejectedExecutionException("Processor is shutting down"));
        }
        if (!permits.tryAcquire()) {
            return CompletableFuture.failedFuture(new RejectedExecutionException(
                    "Leasehold backpressure: " + maxConcurrentCalls + " messages already in flight"));
        }

        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            executor.execute(() -> run(message, done));
        } catch (RejectedExecutionException e) {
            permits.release();
            done.completeExceptionally(e);
        }
        return done;
    }

    private void run(LeasedMessage message, CompletableFuture<Void> done) {
        CancellationSignal cancellation = new CancellationSignal();
        LeaseManager lease = leaseFactory.create(message, cancellation);
        inFlight.put(message.messageId(), new InFlight(lease, cancellation));

        try (lease) {
            lease.initialize();
            if (callbackTimeout != null) {
                CompletableFuture.delayedExecutor(callbackTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .execute(() -> {
                            if (!lease.isActioned()) {
                                log.warn("Message {} exceeded callback timeout {}, cancelling work",
                                        message.messageId(), callbackTimeout);
                                cancellation.cancel();
                            }
                        });
            }

            try {
                handler.handle(message, cancellation);
                lease.complete();
            } catch (NonRetryableMessageException e) {
                log.error("Message {} cannot be processed, dead-lettering", message.messageId(), e);
                lease.deadLetter(e.getCause() != null ? e.getCause() : e);
            } catch (Exception e) {
                log.warn("Message {} failed, abandoning for redelivery", message.messageId(), e);
                lease.abandon(e);
            }
        } finally {
            inFlight.invalidate(message.messageId());
            permits.release();
            done.complete(null);
        }
    }

    /**
     * @return number of messages currently being processed
     */
    public int getInFlightCount() {
        return inFlight.asMap().size();
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Stops accepting messages, abandons every message still in flight, then
     * stops the worker threads.
     */
    public void shutdown() {
        shuttingDown = true;
        List<InFlight> outstanding = new ArrayList<>(inFlight.asMap().values());
        log.info("LeasedMessageProcessor shutting down, releasing {} in-flight messages...", outstanding.size());

        for (InFlight entry : outstanding) {
            entry.lease().close();
            entry.cancellation().cancel();
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker executor did not terminate in {}, forcing shutdown", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        log.info("LeasedMessageProcessor shutdown complete.");
    }

    public static Builder builder() {
        return new Builder();
    }

    private record InFlight(LeaseManager lease, CancellationSignal cancellation) {
    }

    /**
     * Builder for {@link LeasedMessageProcessor}.
     */
    public static class Builder {
        private LeaseManagerFactory leaseFactory;
        private MessageHandler handler;
        private ExecutorService executor;
        private int maxConcurrentCalls = 1;
        private Duration callbackTimeout;
        private Duration inFlightRetention = Duration.ofHours(1);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private String threadNamePrefix = "leasehold-worker-";

        public Builder leaseFactory(LeaseManagerFactory leaseFactory) {
            this.leaseFactory = leaseFactory;
            return this;
        }

        public Builder handler(MessageHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Uses an externally created executor for handler invocations. It is shut
         * down together with the processor.
         *
         * @param executor the executor
         * @return this builder
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Sets the maximum number of messages processed at once. Default is 1.
         *
         * @param maxConcurrentCalls concurrency limit
         * @return this builder
         */
        public Builder maxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
            return this;
        }

        /**
         * Cancels a handler's work once it has run this long. Null (the default)
         * leaves only the lease expiry in charge.
         *
         * @param callbackTimeout the handler time limit
         * @return this builder
         */
        public Builder callbackTimeout(Duration callbackTimeout) {
            this.callbackTimeout = callbackTimeout;
            return this;
        }

        /**
         * Upper bound on how long an in-flight entry is tracked for shutdown.
         * Default is 1 hour.
         *
         * @param retention the retention
         * @return this builder
         */
        public Builder inFlightRetention(Duration retention) {
            this.inFlightRetention = retention;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder threadNamePrefix(String prefix) {
            this.threadNamePrefix = prefix;
            return this;
        }

        /**
         * @return the configured processor
         * @throws IllegalStateException if the lease factory or handler is missing
         */
        public LeasedMessageProcessor build() {
            if (leaseFactory == null || handler == null) {
                throw new IllegalStateException("LeaseManagerFactory and MessageHandler are required.");
            }
            if (maxConcurrentCalls < 1) {
                throw new IllegalStateException("maxConcurrentCalls must be at least 1, was " + maxConcurrentCalls);
            }

            ExecutorService workers = executor != null ? executor : newExecutor();
            return new LeasedMessageProcessor(leaseFactory, handler, workers, maxConcurrentCalls,
                    callbackTimeout, inFlightRetention, shutdownTimeout);
        }

        private ExecutorService newExecutor() {
            AtomicInteger counter = new AtomicInteger();
            ThreadFactory threadFactory = runnable -> {
                Thread thread = new Thread(runnable, threadNamePrefix + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
            return Executors.newFixedThreadPool(maxConcurrentCalls, threadFactory);
        }
    }
}
