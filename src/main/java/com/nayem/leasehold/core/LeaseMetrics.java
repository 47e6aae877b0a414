package com.nayem.leasehold.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for lease dispositions and expiries.
 * <p>
 * A null registry turns every recording method into a no-op.
 * </p>
 */
public class LeaseMetrics {

    private final Map<DispositionAction, Counter> dispositions = new EnumMap<>(DispositionAction.class);
    private final Map<DispositionAction, Counter> failures = new EnumMap<>(DispositionAction.class);
    private final Counter expiredCounter;
    private final Counter rejectedCounter;
    private final AtomicLong activeLeases = new AtomicLong(0);

    public LeaseMetrics(MeterRegistry registry) {
        if (registry != null) {
            for (DispositionAction action : DispositionAction.values()) {
                dispositions.put(action, Counter.builder("leasehold.disposition")
                        .description("Disposition attempts sent to the broker")
                        .tag("action", action.tagValue())
                        .register(registry));
                failures.put(action, Counter.builder("leasehold.disposition.failed")
                        .description("Disposition attempts the broker rejected or that timed out")
                        .tag("action", action.tagValue())
                        .register(registry));
            }

            this.expiredCounter = Counter.builder("leasehold.lease.expired")
                    .description("Leases abandoned because processing overran the lock")
                    .register(registry);

            this.rejectedCounter = Counter.builder("leasehold.lease.rejected")
                    .description("Leases whose lock had already expired when initialized")
                    .register(registry);

            Gauge.builder("leasehold.lease.active", activeLeases, AtomicLong::get)
                    .description("Leases created but not yet disposed or closed")
                    .register(registry);
        } else {
            this.expiredCounter = null;
            this.rejectedCounter = null;
        }
    }

    public void recordDisposition(DispositionAction action) {
        Counter counter = dispositions.get(action);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordFailedDisposition(DispositionAction action) {
        Counter counter = failures.get(action);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordExpired() {
        if (expiredCounter != null) {
            expiredCounter.increment();
        }
    }

    public void recordRejected() {
        if (rejectedCounter != null) {
            rejectedCounter.increment();
        }
    }

    public void leaseOpened() {
        activeLeases.incrementAndGet();
    }

    public void leaseClosed() {
        activeLeases.decrementAndGet();
    }

    public long getActiveLeases() {
        return activeLeases.get();
    }

    public static LeaseMetrics noOp() {
        return new LeaseMetrics(null);
    }
}
