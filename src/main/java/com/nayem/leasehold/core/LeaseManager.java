package com.nayem.leasehold.core;

import com.nayem.leasehold.broker.BrokerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Guards the lock a consumer holds on a single received message.
 * <p>
 * Exactly one disposition (complete, abandon or dead-letter) is ever sent to
 * the broker for the message, whichever of these gets there first:
 * <ul>
 * <li>application code calling {@link #complete()}, {@link #abandon(Throwable)}
 * or {@link #deadLetter(Throwable)};</li>
 * <li>the expiry timer armed by {@link #initialize()}, which abandons the
 * message and then cancels the shared work signal;</li>
 * <li>{@link #close()}, which abandons whatever has not been disposed yet.</li>
 * </ul>
 * All three paths serialize on one lock that covers the guard check, the broker
 * call and the state update. Broker failures are logged and swallowed: the
 * attempt still counts, so the guarantee is at most one attempt, not at least
 * one success.
 * </p>
 * <p>
 * While the caller signal is cancelled, {@code complete}, {@code abandon} and
 * {@code deadLetter} are no-ops. The expiry and teardown paths ignore it.
 * </p>
 */
public class LeaseManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);

    private static final BigDecimal RENEWAL_FACTOR = new BigDecimal("0.9");
    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private final LeasedMessage message;
    private final BrokerClient broker;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Executor expiryExecutor;
    private final CancellationSignal workSignal;
    private final CancellationSignal callerSignal;
    private final LeaseMetrics metrics;
    private final Duration brokerTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean released = new AtomicBoolean(false);

    // written under lock
    private volatile LeaseStatus status = LeaseStatus.ACTIVE;
    private volatile DispositionAction appliedAction;
    private volatile Duration renewalDeadline;
    private ScheduledFuture<?> timer;
    private boolean initialized;

    /**
     * Creates a lease whose expiry abandon runs on the scheduler thread itself.
     *
     * @see #LeaseManager(LeasedMessage, BrokerClient, Clock, ScheduledExecutorService, Executor,
     *      CancellationSignal, CancellationSignal, LeaseMetrics, Duration)
     */
    public LeaseManager(LeasedMessage message,
            BrokerClient broker,
            Clock clock,
            ScheduledExecutorService scheduler,
            CancellationSignal workSignal,
            CancellationSignal callerSignal,
            LeaseMetrics metrics,
            Duration brokerTimeout) {
        this(message, broker, clock, scheduler, Runnable::run, workSignal, callerSignal, metrics, brokerTimeout);
    }

    /**
     * @param message        the received message
     * @param broker         client used for the terminal call
     * @param clock          source of the current UTC time
     * @param scheduler      fires the expiry timer
     * @param expiryExecutor runs the expiry abandon handed off by the timer, so a
     *                       slow broker call does not hold up other leases' timers
     * @param workSignal    signal shared with the processing code; cancelled after
     *                      an expiry abandon
     * @param callerSignal  when cancelled, explicit dispositions are no-ops
     * @param metrics       metrics sink
     * @param brokerTimeout how long to wait for a broker call; null waits forever
     */
    public LeaseManager(LeasedMessage message,
            BrokerClient broker,
            Clock clock,
            ScheduledExecutorService scheduler,
            Executor expiryExecutor,
            CancellationSignal workSignal,
            CancellationSignal callerSignal,
            LeaseMetrics metrics,
            Duration brokerTimeout) {
        this.message = Objects.requireNonNull(message, "message");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.expiryExecutor = Objects.requireNonNull(expiryExecutor, "expiryExecutor");
        this.workSignal = Objects.requireNonNull(workSignal, "workSignal");
        this.callerSignal = Objects.requireNonNull(callerSignal, "callerSignal");
        this.metrics = metrics != null ? metrics : LeaseMetrics.noOp();
        this.brokerTimeout = brokerTimeout;
        this.metrics.leaseOpened();
    }

    /**
     * Arms the expiry timer at 90% of the time left on the lock.
     * <p>
     * If the lock has already expired the message is abandoned straight away and
     * no timer is armed.
     * </p>
     *
     * @throws IllegalStateException if called more than once
     */
    public void initialize() {
        boolean expired;
        lock.lock();
        try {
            if (initialized) {
                throw new IllegalStateException("Lease for message " + message.messageId() + " is already initialized");
            }
            initialized = true;

            Duration remaining = Duration.between(clock.instant(), message.lockedUntilUtc());
            Duration deadline = renewalDeadline(remaining);
            renewalDeadline = deadline;
            expired = deadline.isNegative();

            if (!expired) {
                if (status.isTerminal()) {
                    log.debug("Message {} was disposed before its lease was initialized", message.messageId());
                    return;
                }
                log.info("Message {} will be given {} minutes to execute before automatic cancellation.",
                        message.messageId(), deadline.toMinutes());
                timer = scheduler.schedule(this::handOffExpiry, saturatedNanos(deadline), TimeUnit.NANOSECONDS);
                status = LeaseStatus.RENEWING;
            }
        } finally {
            lock.unlock();
        }

        if (expired) {
            log.error("Invalid message lock renewal value {} for message {}. Rejecting message.",
                    renewalDeadline, message.messageId());
            metrics.recordRejected();
            dispose(DispositionAction.ABANDON, null, Trigger.CALLER);
        }
    }

    public void complete() {
        dispose(DispositionAction.COMPLETE, null, Trigger.CALLER);
    }

    public void abandon() {
        abandon(null);
    }

    /**
     * @param error processing failure to record on the message, may be null
     */
    public void abandon(Throwable error) {
        dispose(DispositionAction.ABANDON, error, Trigger.CALLER);
    }

    public void deadLetter() {
        deadLetter(null);
    }

    /**
     * @param error processing failure to record on the message, may be null
     */
    public void deadLetter(Throwable error) {
        dispose(DispositionAction.DEAD_LETTER, error, Trigger.CALLER);
    }

    /**
     * Abandons the message unless it was already disposed. Ignores the caller
     * signal and blocks until the broker call resolves. The lease stops counting
     * as active even when nothing was sent.
     */
    @Override
    public void close() {
        dispose(DispositionAction.ABANDON, null, Trigger.TEARDOWN);
        release();
    }

    public LeasedMessage getMessage() {
        return message;
    }

    public LeaseStatus getStatus() {
        return status;
    }

    public boolean isActioned() {
        return status.isTerminal();
    }

    /**
     * @return the disposition that was attempted, empty until the lease is actioned
     */
    public Optional<DispositionAction> getAppliedAction() {
        return Optional.ofNullable(appliedAction);
    }

    /**
     * @return the delay computed by {@link #initialize()}, empty before it
     */
    public Optional<Duration> getRenewalDeadline() {
        return Optional.ofNullable(renewalDeadline);
    }

    /**
     * 90% of {@code remaining}, rounded to the nearest nanosecond with ties away
     * from zero.
     */
    static Duration renewalDeadline(Duration remaining) {
        BigDecimal nanos = new BigDecimal(BigInteger.valueOf(remaining.getSeconds()).multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(remaining.getNano())));
        BigInteger scaled = nanos.multiply(RENEWAL_FACTOR).setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();
        BigInteger[] parts = scaled.divideAndRemainder(NANOS_PER_SECOND);
        return Duration.ofSeconds(parts[0].longValueExact(), parts[1].longValue());
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void handOffExpiry() {
        try {
            expiryExecutor.execute(this::onExpired);
        } catch (RejectedExecutionException e) {
            log.warn("Expiry executor rejected message {}, abandoning on the timer thread", message.messageId());
            onExpired();
        }
    }

    private void onExpired() {
        log.warn("Message {} did not process in expected time, it will be abandoned and work cancelled.",
                message.messageId());

        boolean attempted = dispose(DispositionAction.ABANDON, null, Trigger.EXPIRY);
        if (attempted) {
            metrics.recordExpired();
            // only now: observers of the work signal may assume the message is back with the broker
            workSignal.cancel();
        }
    }

    /**
     * @return true if this call made the broker attempt
     */
    private boolean dispose(DispositionAction action, Throwable error, Trigger trigger) {
        lock.lock();
        try {
            if (!canAction(trigger)) {
                return false;
            }

            try {
                await(send(action, error));
                metrics.recordDisposition(action);
                log.debug("Message {} disposed: action={}, trigger={}", message.messageId(), action, trigger);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed(action, e);
            } catch (ExecutionException e) {
                failed(action, e.getCause() != null ? e.getCause() : e);
            } catch (TimeoutException | RuntimeException e) {
                failed(action, e);
            }

            appliedAction = action;
            status = LeaseStatus.ACTIONED;
            release();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            metrics.leaseClosed();
        }
    }

    private boolean canAction(Trigger trigger) {
        if (trigger == Trigger.CALLER && callerSignal.isCancellationRequested()) {
            log.debug("Skipping disposition of message {}: caller cancelled", message.messageId());
            return false;
        }

        if (status.isTerminal()) {
            return false;
        }

        if (trigger == Trigger.EXPIRY) {
            status = LeaseStatus.EXPIRED;
        }

        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        return true;
    }

    private CompletableFuture<Void> send(DispositionAction action, Throwable error) {
        CompletableFuture<Void> call = switch (action) {
            case COMPLETE -> broker.complete(message.lockToken());
            case ABANDON -> broker.abandon(message.lockToken(),
                    ExceptionTags.propertiesFor(message.userProperties(), error));
            case DEAD_LETTER -> broker.deadLetter(message.lockToken(),
                    ExceptionTags.propertiesFor(message.userProperties(), error));
        };
        if (call == null) {
            throw new IllegalStateException("Broker client returned no result for " + action);
        }
        return call;
    }

    private void await(CompletableFuture<Void> call)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (brokerTimeout == null) {
            call.get();
            return;
        }
        try {
            call.get(brokerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw e;
        }
    }

    private void failed(DispositionAction action, Throwable cause) {
        metrics.recordFailedDisposition(action);
        log.error("Failed to action message {}: action={}", message.messageId(), action, cause);
    }

    @Override
    public String toString() {
        return "LeaseManager[messageId=" + message.messageId() + ", status=" + status
                + ", action=" + appliedAction + "]";
    }

    private enum Trigger {
        CALLER,
        EXPIRY,
        TEARDOWN
    }
}
