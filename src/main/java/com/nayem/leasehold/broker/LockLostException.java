package com.nayem.leasehold.broker;

/**
 * Thrown by a {@link BrokerClient} when the lock named by a lock token no
 * longer exists on the broker. Retrying the call cannot succeed.
 */
public class LockLostException extends RuntimeException {

    public LockLostException(String lockToken) {
        super("Lock lost for token " + lockToken);
    }

    public LockLostException(String lockToken, Throwable cause) {
        super("Lock lost for token " + lockToken, cause);
    }
}
