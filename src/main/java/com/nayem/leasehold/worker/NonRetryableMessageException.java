package com.nayem.leasehold.worker;

/**
 * Thrown by a {@link MessageHandler} when a message can never be processed
 * (malformed payload, unknown type). The message is dead-lettered instead of
 * being redelivered.
 */
public class NonRetryableMessageException extends RuntimeException {

    public NonRetryableMessageException(String message) {
        super(message);
    }

    public NonRetryableMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
