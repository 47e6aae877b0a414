package com.nayem.leasehold.core;

/**
 * Lifecycle state of a {@link LeaseManager}.
 */
public enum LeaseStatus {

    /**
     * Created, expiry timer not armed yet.
     */
    ACTIVE,

    /**
     * Expiry timer armed; the message is being processed.
     */
    RENEWING,

    /**
     * Expiry timer fired; the self-abandon is under way.
     */
    EXPIRED,

    /**
     * A disposition was attempted. Terminal.
     */
    ACTIONED;

    public boolean isTerminal() {
        return this == ACTIONED;
    }
}
