package com.nayem.leasehold.broker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Terminal operations a broker offers on a locked message.
 * <p>
 * Implementations must be thread-safe. A failed operation is reported through
 * the returned future, or by throwing.
 * </p>
 */
public interface BrokerClient {

    /**
     * Acknowledges the message; the broker removes it.
     *
     * @param lockToken token of the lock held on the message
     */
    CompletableFuture<Void> complete(String lockToken);

    /**
     * Releases the lock so the message becomes visible for redelivery.
     *
     * @param lockToken  token of the lock held on the message
     * @param properties properties to merge into the message, possibly empty
     */
    CompletableFuture<Void> abandon(String lockToken, Map<String, Object> properties);

    /**
     * Moves the message to the dead-letter destination.
     *
     * @param lockToken  token of the lock held on the message
     * @param properties properties to merge into the message, possibly empty
     */
    CompletableFuture<Void> deadLetter(String lockToken, Map<String, Object> properties);
}
