package org.sagebionetworks.mutex.redis;

/**
 * Redis could not be reached: connection refused or dropped, socket timeout, or no pooled connection available.
 * The outcome of a write that fails this way is unknown.
 */
@SuppressWarnings("serial")
public class StoreUnavailableException extends RedisException {

    public StoreUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
