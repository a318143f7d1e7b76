package org.sagebionetworks.mutex.lock;

import org.sagebionetworks.mutex.redis.RedisException;

/** The release script for a lock could not run. The handle keeps its token, so the release can be retried. */
@SuppressWarnings("serial")
public class ScriptExecutionFailedException extends RedisException {

    public ScriptExecutionFailedException(final String key, final Throwable cause) {
        super("Release script failed for lock " + key + ": " + cause.getMessage(), cause);
    }
}
