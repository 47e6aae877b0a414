package com.nayem.leasehold.worker;

import com.nayem.leasehold.core.CancellationSignal;
import com.nayem.leasehold.core.LeasedMessage;

/**
 * Application callback that processes one leased message.
 * <p>
 * Returning normally completes the message. Throwing
 * {@link NonRetryableMessageException} dead-letters it; any other exception
 * abandons it for redelivery.
 * </p>
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * @param message      the message to process
     * @param cancellation cancelled when the lease expired or the processor is
     *                     stopping; long-running handlers should poll it
     */
    void handle(LeasedMessage message, CancellationSignal cancellation) throws Exception;
}
