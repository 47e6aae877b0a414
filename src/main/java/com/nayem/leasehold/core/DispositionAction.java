package com.nayem.leasehold.core;

/**
 * Terminal outcome applied to a leased message.
 */
public enum DispositionAction {

    /**
     * Acknowledge the message; the broker removes it.
     */
    COMPLETE,

    /**
     * Release the lock so the message is redelivered.
     */
    ABANDON,

    /**
     * Move the message to the dead-letter destination.
     */
    DEAD_LETTER;

    String tagValue() {
        return name().toLowerCase();
    }
}
