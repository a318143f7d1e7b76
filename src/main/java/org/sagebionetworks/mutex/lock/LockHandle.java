package org.sagebionetworks.mutex.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.mutex.redis.RedisOps;

/**
 * A lock acquired through {@link RedisLock}. Meant for try-with-resources:
 * <pre>
 * Optional&lt;LockHandle&gt; lock = redisLock.acquire("upload:" + id, Duration.ofSeconds(10));
 * if (!lock.isPresent()) {
 *     throw new ConcurrentModificationException("upload " + id + " is being processed");
 * }
 * try (LockHandle handle = lock.get()) {
 *     // protected work
 * }
 * </pre>
 * Release happens only through {@link #release()} or {@link #close()}. Nothing releases a handle that is dropped
 * without being closed; its key stays locked until the TTL expires.
 */
public class LockHandle extends AbstractLockHandle {
    private static final Logger LOG = LoggerFactory.getLogger(LockHandle.class);

    private final RedisOps ops;

    LockHandle(RedisOps ops, String key, long ttlMillis, String token) {
        super(key, ttlMillis, token);
        this.ops = ops;
    }

    /**
     * Releases the lock if this handle still holds it. Calling it again is a no-op that does not touch Redis.
     *
     * @return true if the key was deleted; false if the handle was already released, or the key had expired or
     *         been taken over by another holder, in which case it is left alone
     * @throws ScriptExecutionFailedException if Redis could not run the release; the handle stays held so the
     *         release can be retried
     */
    public boolean release() {
        final String token = getToken();
        if (token == null) {
            return false;
        }
        final boolean deleted = CompareAndDelete.run(ops, getKey(), token);
        if (!deleted) {
            LOG.debug("Lock " + getKey() + " expired or changed owner before release; left it alone.");
        }
        clearToken();
        return deleted;
    }

    /** Releases the lock, unless suppressed. Failures are logged, not thrown. */
    @Override
    public void close() {
        if (!shouldReleaseOnClose()) {
            return;
        }
        try {
            release();
        } catch (RuntimeException ex) {
            LOG.error("Failed to release lock " + getKey() + " on close: " + ex.getMessage(), ex);
        }
    }
}
