package org.sagebionetworks.mutex.lock;

import org.sagebionetworks.mutex.redis.RedisException;

/**
 * The <code>SET NX</code> for a lock failed in transit, and reading the key back did not show our token. The lock
 * may or may not be held by someone else; callers must not assume either. The cause is the error of the failed write.
 */
@SuppressWarnings("serial")
public class AmbiguousWriteOutcomeException extends RedisException {

    public AmbiguousWriteOutcomeException(final String key, final Throwable cause) {
        super("Outcome of acquiring lock " + key + " is unknown: " + cause.getMessage(), cause);
    }
}
