package com.nayem.leasehold.core;

import com.nayem.leasehold.broker.BrokerClient;
import com.nayem.leasehold.broker.InMemoryBrokerClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the LeaseManager state machine. The expiry timer is captured
 * from a mocked scheduler and fired by hand.
 */
public class LeaseManagerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private Clock clock;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<Object> timerFuture;
    private InMemoryBrokerClient broker;
    private CancellationSignal workSignal;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        scheduler = mock(ScheduledExecutorService.class);
        timerFuture = mock(ScheduledFuture.class);
        doReturn(timerFuture).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        broker = new InMemoryBrokerClient();
        workSignal = new CancellationSignal();
    }

    private LeasedMessage message(Duration lockRemaining) {
        return new LeasedMessage("msg-1", "lock-1", NOW.plus(lockRemaining));
    }

    private LeaseManager lease(LeasedMessage message, BrokerClient client) {
        return new LeaseManager(message, client, clock, scheduler, workSignal, workSignal,
                LeaseMetrics.noOp(), Duration.ofSeconds(5));
    }

    private Runnable capturedTimer() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(captor.capture(), anyLong(), eq(TimeUnit.NANOSECONDS));
        return captor.getValue();
    }

    @Test
    void testRenewalDeadlineIsNinetyPercentOfRemainingLock() {
        assertEquals(Duration.ofMinutes(9), LeaseManager.renewalDeadline(Duration.ofMinutes(10)));
        assertEquals(Duration.ofSeconds(270), LeaseManager.renewalDeadline(Duration.ofMinutes(5)));
        assertEquals(Duration.ZERO, LeaseManager.renewalDeadline(Duration.ZERO));
    }

    /**
     * Ties round away from zero in both directions.
     */
    @Test
    void testRenewalDeadlineRoundsTiesAwayFromZero() {
        assertEquals(Duration.ofNanos(5), LeaseManager.renewalDeadline(Duration.ofNanos(5)));   // 4.5
        assertEquals(Duration.ofNanos(-5), LeaseManager.renewalDeadline(Duration.ofNanos(-5))); // -4.5
        assertEquals(Duration.ofNanos(1), LeaseManager.renewalDeadline(Duration.ofNanos(1)));   // 0.9
        assertEquals(Duration.ofNanos(13), LeaseManager.renewalDeadline(Duration.ofNanos(14))); // 12.6
    }

    @Test
    void testInitializeSchedulesTimerAtNinetyPercent() {
        LeaseManager lease = lease(message(Duration.ofMinutes(10)), broker);

        lease.initialize();

        verify(scheduler).schedule(any(Runnable.class), eq(Duration.ofMinutes(9).toNanos()), eq(TimeUnit.NANOSECONDS));
        assertEquals(LeaseStatus.RENEWING, lease.getStatus());
        assertEquals(Optional.of(Duration.ofMinutes(9)), lease.getRenewalDeadline());
        assertEquals(0, broker.size());
    }

    @Test
    void testInitializeWithExpiredLockAbandonsWithoutTimer() {
        LeaseManager lease = lease(message(Duration.ofSeconds(-30)), broker);

        lease.initialize();

        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        List<InMemoryBrokerClient.Disposition> calls = broker.getDispositions();
        assertEquals(1, calls.size());
        assertEquals(DispositionAction.ABANDON, calls.get(0).action());
        assertEquals("lock-1", calls.get(0).lockToken());
        assertTrue(calls.get(0).properties().isEmpty());
        assertEquals(LeaseStatus.ACTIONED, lease.getStatus());
        assertFalse(workSignal.isCancellationRequested());
    }

    @Test
    void testInitializeTwiceFails() {
        LeaseManager lease = lease(message(Duration.ofMinutes(1)), broker);
        lease.initialize();

        assertThrows(IllegalStateException.class, lease::initialize);
    }

    @Test
    void testDispositionBeforeInitializeSkipsTimer() {
        LeaseManager lease = lease(message(Duration.ofMinutes(1)), broker);
        lease.complete();

        lease.initialize();

        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertEquals(1, broker.size());
    }

    /**
     * Five minutes of lock and no disposition: the timer abandons the message and
     * only then cancels the work signal. A late complete() is a no-op.
     */
    @Test
    void testTimerFireAbandonsThenCancelsWork() {
        List<String> events = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> abandonCall = new CompletableFuture<>();
        BrokerClient slowBroker = mock(BrokerClient.class);
        when(slowBroker.abandon(anyString(), anyMap())).thenAnswer(invocation -> {
            events.add("abandon-sent cancelled=" + workSignal.isCancellationRequested());
            CompletableFuture.runAsync(() -> {
                events.add("abandon-resolved");
                abandonCall.complete(null);
            }, CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));
            return abandonCall;
        });
        workSignal.onCancel(() -> events.add("work-cancelled"));

        LeaseManager lease = lease(message(Duration.ofMinutes(5)), slowBroker);
        lease.initialize();
        verify(scheduler).schedule(any(Runnable.class), eq(Duration.ofSeconds(270).toNanos()), eq(TimeUnit.NANOSECONDS));

        capturedTimer().run();

        assertEquals(List.of("abandon-sent cancelled=false", "abandon-resolved", "work-cancelled"), events);
        assertTrue(workSignal.isCancellationRequested());
        assertEquals(LeaseStatus.ACTIONED, lease.getStatus());
        assertEquals(Optional.of(DispositionAction.ABANDON), lease.getAppliedAction());

        lease.complete();
        verify(slowBroker, times(1)).abandon(anyString(), anyMap());
        verify(slowBroker, never()).complete(anyString());
    }

    @Test
    void testTimerAfterExplicitDispositionDoesNothing() {
        LeaseManager lease = lease(message(Duration.ofMinutes(5)), broker);
        lease.initialize();
        Runnable timer = capturedTimer();

        lease.complete();
        timer.run();

        assertEquals(1, broker.size());
        assertEquals(DispositionAction.COMPLETE, broker.getDispositions().get(0).action());
        assertFalse(workSignal.isCancellationRequested());
    }

    @Test
    void testDispositionStopsTimer() {
        LeaseManager lease = lease(message(Duration.ofMinutes(5)), broker);
        lease.initialize();

        lease.deadLetter();

        verify(timerFuture).cancel(false);
    }

    @Test
    void testCompleteThenAbandonOnlyCompletes() {
        LeaseManager lease = lease(message(Duration.ofMinutes(5)), broker);
        lease.initialize();

        lease.complete();
        lease.abandon(new RuntimeException("late"));

        assertEquals(1, broker.size());
        InMemoryBrokerClient.Disposition call = broker.getDispositions().get(0);
        assertEquals(DispositionAction.COMPLETE, call.action());
        assertTrue(call.properties().isEmpty());
        assertEquals(Optional.of(DispositionAction.COMPLETE), lease.getAppliedAction());
    }

    @Test
    void testCancelledCallerMakesExplicitDispositionsNoOps() {
        LeaseManager lease = lease(message(Duration.ofMinutes(5)), broker);
        lease.initialize();
        workSignal.cancel();

        lease.complete();
        lease.abandon();
        lease.deadLetter();

        assertEquals(0, broker.size());
        assertEquals(LeaseStatus.RENEWING, lease.getStatus());
    }

    /**
     * Teardown releases the message even when the caller has already cancelled.
     */
    @Test
    void testCloseAbandonsDespiteCancelledCaller() {
        LeaseManager lease = lease(message(Duration.ofMinutes(5)), broker);
        lease.initialize();
        workSignal.cancel();

        lease.close();

        assertEquals(1, broker.size());
        assertEquals(DispositionAction.ABANDON, broker.getDispositions().get(0).action());
        verify(timerFuture).cancel(false);
    }

    @Test
    void testCloseAfterDispositionIsNoOp() {
        try (LeaseManager lease = lease(message(Duration.ofMinutes(5)), broker)) {
            lease.initialize();
            lease.deadLetter(new IllegalArgumentException("poison"));
        }

        assertEquals(1, broker.size());
        assertEquals(DispositionAction.DEAD_LETTER, broker.getDispositions().get(0).action());
    }

    @Test
    void testScopeExitWithoutDispositionAbandonsOnce() {
        try (LeaseManager lease = lease(message(Duration.ofMinutes(5)), broker)) {
            lease.initialize();
        }

        assertEquals(1, broker.size());
        assertEquals(DispositionAction.ABANDON, broker.getDispositions().get(0).action());
    }

    @Test
    void testAbandonAndDeadLetterAppendExceptionTags() {
        Map<String, Object> previous = Map.of(ExceptionTags.EXCEPTIONS_KEY, "TimeoutException");

        LeaseManager first = lease(new LeasedMessage("m-1", "lock-a", NOW.plusSeconds(60), previous), broker);
        first.abandon(new IllegalStateException("boom"));

        LeaseManager second = lease(new LeasedMessage("m-2", "lock-b", NOW.plusSeconds(60), previous), broker);
        second.deadLetter(new NumberFormatException("bad"));

        assertEquals("TimeoutException:IllegalStateException",
                broker.getDispositions("lock-a").get(0).properties().get(ExceptionTags.EXCEPTIONS_KEY));
        assertEquals("TimeoutException:NumberFormatException",
                broker.getDispositions("lock-b").get(0).properties().get(ExceptionTags.EXCEPTIONS_KEY));
    }

    @Test
    void testFailedBrokerCallIsSwallowedAndCounts() {
        BrokerClient failing = mock(BrokerClient.class);
        when(failing.complete(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        LeaseManager lease = lease(message(Duration.ofMinutes(5)), failing);
        lease.initialize();

        assertDoesNotThrow(lease::complete);
        lease.abandon();
        lease.close();

        assertEquals(LeaseStatus.ACTIONED, lease.getStatus());
        verify(failing, times(1)).complete("lock-1");
        verify(failing, never()).abandon(anyString(), anyMap());
    }

    @Test
    void testThrowingBrokerCallIsSwallowed() {
        BrokerClient throwing = mock(BrokerClient.class);
        when(throwing.deadLetter(anyString(), anyMap())).thenThrow(new RuntimeException("connection reset"));
        LeaseManager lease = lease(message(Duration.ofMinutes(5)), throwing);

        assertDoesNotThrow(() -> lease.deadLetter(new RuntimeException("poison")));

        assertTrue(lease.isActioned());
        assertEquals(Optional.of(DispositionAction.DEAD_LETTER), lease.getAppliedAction());
    }

    @Test
    void testBrokerTimeoutCountsAsAttempt() {
        BrokerClient hanging = mock(BrokerClient.class);
        CompletableFuture<Void> neverCompletes = new CompletableFuture<>();
        when(hanging.complete(anyString())).thenReturn(neverCompletes);
        LeaseManager lease = new LeaseManager(message(Duration.ofMinutes(5)), hanging, clock, scheduler,
                workSignal, workSignal, LeaseMetrics.noOp(), Duration.ofMillis(100));

        long start = System.nanoTime();
        lease.complete();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs < 2000, "complete() should give up after the broker timeout");
        assertTrue(neverCompletes.isCancelled());
        assertTrue(lease.isActioned());
    }

    @Test
    void testMetricsRecordDispositionsAndExpiry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LeaseMetrics metrics = new LeaseMetrics(registry);

        LeaseManager expiring = new LeaseManager(message(Duration.ofMinutes(5)), broker, clock, scheduler,
                workSignal, workSignal, metrics, null);
        expiring.initialize();
        assertEquals(1, metrics.getActiveLeases());
        capturedTimer().run();

        LeaseManager rejected = new LeaseManager(new LeasedMessage("m-2", "lock-2", NOW.minusSeconds(1)), broker,
                clock, scheduler, new CancellationSignal(), CancellationSignal.none(), metrics, null);
        rejected.initialize();

        assertEquals(2.0, registry.get("leasehold.disposition").tag("action", "abandon").counter().count());
        assertEquals(1.0, registry.get("leasehold.lease.expired").counter().count());
        assertEquals(1.0, registry.get("leasehold.lease.rejected").counter().count());
        assertEquals(0.0, registry.get("leasehold.lease.active").gauge().value());
    }

    /**
     * The timer task only hands the expiry off; the abandon runs on the expiry
     * executor.
     */
    @Test
    void testTimerHandsExpiryToExpiryExecutor() {
        List<Runnable> handedOff = new CopyOnWriteArrayList<>();
        LeaseManager lease = new LeaseManager(message(Duration.ofMinutes(5)), broker, clock, scheduler,
                handedOff::add, workSignal, workSignal, LeaseMetrics.noOp(), Duration.ofSeconds(5));
        lease.initialize();

        capturedTimer().run();

        assertEquals(0, broker.size());
        assertEquals(1, handedOff.size());
        assertFalse(workSignal.isCancellationRequested());

        handedOff.get(0).run();

        assertEquals(1, broker.size());
        assertEquals(DispositionAction.ABANDON, broker.getDispositions().get(0).action());
        assertTrue(workSignal.isCancellationRequested());
    }

    @Test
    void testRejectedHandOffAbandonsOnTimerThread() {
        LeaseManager lease = new LeaseManager(message(Duration.ofMinutes(5)), broker, clock, scheduler,
                task -> {
                    throw new RejectedExecutionException("shut down");
                },
                workSignal, workSignal, LeaseMetrics.noOp(), Duration.ofSeconds(5));
        lease.initialize();

        capturedTimer().run();

        assertEquals(1, broker.size());
        assertTrue(workSignal.isCancellationRequested());
    }

    @Test
    void testExpiryWithUncancellableWorkSignal() {
        LeaseManager lease = new LeaseManager(message(Duration.ofMinutes(5)), broker, clock, scheduler,
                CancellationSignal.none(), CancellationSignal.none(), LeaseMetrics.noOp(), Duration.ofSeconds(5));
        lease.initialize();

        assertDoesNotThrow(() -> capturedTimer().run());

        assertEquals(1, broker.size());
        assertEquals(Optional.of(DispositionAction.ABANDON), lease.getAppliedAction());
    }

    /**
     * A lease whose caller gave up stays active until it is closed, and close()
     * releases it exactly once.
     */
    @Test
    void testActiveGaugeReleasedOnCloseAfterCallerCancelled() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LeaseMetrics metrics = new LeaseMetrics(registry);
        LeaseManager lease = new LeaseManager(message(Duration.ofMinutes(5)), broker, clock, scheduler,
                workSignal, workSignal, metrics, null);
        lease.initialize();
        workSignal.cancel();

        lease.complete();
        assertEquals(1, metrics.getActiveLeases());

        lease.close();
        lease.close();

        assertEquals(0, metrics.getActiveLeases());
        assertEquals(0.0, registry.get("leasehold.lease.active").gauge().value());
    }
}
