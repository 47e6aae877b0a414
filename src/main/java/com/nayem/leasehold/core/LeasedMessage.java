package com.nayem.leasehold.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of a message received from the broker together with the lock
 * that grants this consumer exclusive access to it.
 *
 * @param messageId      broker-assigned message identifier
 * @param lockToken      opaque token identifying the lock, passed back on
 *                       disposition
 * @param lockedUntilUtc instant at which the broker lock expires
 * @param userProperties application properties carried by the message
 */
public record LeasedMessage(
        String messageId,
        String lockToken,
        Instant lockedUntilUtc,
        Map<String, Object> userProperties) {

    public LeasedMessage {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(lockToken, "lockToken");
        Objects.requireNonNull(lockedUntilUtc, "lockedUntilUtc");
        // property values may be null, so no Map.copyOf
        userProperties = userProperties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(userProperties));
    }

    public LeasedMessage(String messageId, String lockToken, Instant lockedUntilUtc) {
        this(messageId, lockToken, lockedUntilUtc, Map.of());
    }
}
