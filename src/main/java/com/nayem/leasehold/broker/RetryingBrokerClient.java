package com.nayem.leasehold.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * {@link BrokerClient} decorator that retries failed terminal calls with
 * exponential backoff.
 * <p>
 * Failures for which {@code retryable} answers false are reported at once; by
 * default that is only {@link LockLostException}. Retries stop early if the
 * caller cancels or times out the returned future.
 * </p>
 */
public class RetryingBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingBrokerClient.class);

    private final BrokerClient delegate;
    private final int maxRetries;
    private final long minBackoffMs;
    private final long maxBackoffMs;
    private final BackoffStrategy backoff;
    private final Predicate<Throwable> retryable;

    public RetryingBrokerClient(BrokerClient delegate, int maxRetries, Duration minBackoff, Duration maxBackoff) {
        this(delegate, maxRetries, minBackoff, maxBackoff, new BackoffStrategy(0.5),
                error -> !(error instanceof LockLostException));
    }

    public RetryingBrokerClient(BrokerClient delegate,
            int maxRetries,
            Duration minBackoff,
            Duration maxBackoff,
            BackoffStrategy backoff,
            Predicate<Throwable> retryable) {
        if (minBackoff.compareTo(maxBackoff) > 0) {
            throw new IllegalArgumentException(
                    "Minimum backoff " + minBackoff + " exceeds maximum backoff " + maxBackoff);
        }
        this.delegate = delegate;
        this.maxRetries = Math.max(0, maxRetries);
        this.minBackoffMs = minBackoff.toMillis();
        this.maxBackoffMs = maxBackoff.toMillis();
        this.backoff = backoff;
        this.retryable = retryable;
    }

    @Override
    public CompletableFuture<Void> complete(String lockToken) {
        return withRetry("complete", lockToken, () -> delegate.complete(lockToken));
    }

    @Override
    public CompletableFuture<Void> abandon(String lockToken, Map<String, Object> properties) {
        return withRetry("abandon", lockToken, () -> delegate.abandon(lockToken, properties));
    }

    @Override
    public CompletableFuture<Void> deadLetter(String lockToken, Map<String, Object> properties) {
        return withRetry("deadLetter", lockToken, () -> delegate.deadLetter(lockToken, properties));
    }

    private CompletableFuture<Void> withRetry(String operation, String lockToken,
            Supplier<CompletableFuture<Void>> call) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt(operation, lockToken, call, 0, result);
        return result;
    }

    private void attempt(String operation, String lockToken, Supplier<CompletableFuture<Void>> call,
            int attempt, CompletableFuture<Void> result) {
        if (result.isDone()) {
            return;
        }

        CompletableFuture<Void> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((ignored, error) -> {
            if (error == null) {
                result.complete(null);
                return;
            }

            Throwable cause = unwrap(error);
            if (attempt >= maxRetries || !retryable.test(cause)) {
                result.completeExceptionally(cause);
                return;
            }

            long delayMs = backoff.calculateBackoff(attempt, minBackoffMs, maxBackoffMs);
            log.warn("Broker {} failed for lockToken={} (attempt {}/{}), retrying in {}ms: {}",
                    operation, lockToken, attempt + 1, maxRetries + 1, delayMs, cause.toString());
            CompletableFuture.runAsync(
                    () -> attempt(operation, lockToken, call, attempt + 1, result),
                    CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS));
        });
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException)
                && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
