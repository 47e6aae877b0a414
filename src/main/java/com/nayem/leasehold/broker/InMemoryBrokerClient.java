package com.nayem.leasehold.broker;

import com.nayem.leasehold.core.DispositionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link BrokerClient}.
 * <p>
 * Records every terminal call instead of talking to a broker. Suitable for
 * development and testing.
 * </p>
 */
public class InMemoryBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBrokerClient.class);

    private final Queue<Disposition> dispositions = new ConcurrentLinkedQueue<>();

    @Override
    public CompletableFuture<Void> complete(String lockToken) {
        return record(DispositionAction.COMPLETE, lockToken, Map.of());
    }

    @Override
    public CompletableFuture<Void> abandon(String lockToken, Map<String, Object> properties) {
        return record(DispositionAction.ABANDON, lockToken, properties);
    }

    @Override
    public CompletableFuture<Void> deadLetter(String lockToken, Map<String, Object> properties) {
        return record(DispositionAction.DEAD_LETTER, lockToken, properties);
    }

    private CompletableFuture<Void> record(DispositionAction action, String lockToken,
            Map<String, Object> properties) {
        Disposition disposition = new Disposition(action, lockToken,
                properties != null ? Map.copyOf(properties) : Map.of(), Instant.now());
        dispositions.offer(disposition);
        log.info("Message disposed: action={}, lockToken={}, properties={}", action, lockToken, properties);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * @return all recorded dispositions, oldest first
     */
    public List<Disposition> getDispositions() {
        return List.copyOf(dispositions);
    }

    /**
     * @return dispositions recorded for one lock token, oldest first
     */
    public List<Disposition> getDispositions(String lockToken) {
        return dispositions.stream()
                .filter(d -> d.lockToken().equals(lockToken))
                .toList();
    }

    public long size() {
        return dispositions.size();
    }

    /**
     * Clears all recorded dispositions (for testing).
     */
    public void clear() {
        dispositions.clear();
    }

    /**
     * A terminal call received by this client.
     */
    public record Disposition(
            DispositionAction action,
            String lockToken,
            Map<String, Object> properties,
            Instant timestamp) {
    }
}
