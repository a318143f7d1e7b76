package org.sagebionetworks.mutex.redis;

/**
 * Base class of every failure talking to Redis. Lock contention is never reported through this type; it is reported
 * as an empty result by the lock APIs.
 */
@SuppressWarnings("serial")
public class RedisException extends RuntimeException {

    public RedisException(final String message) {
        super(message);
    }

    public RedisException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
