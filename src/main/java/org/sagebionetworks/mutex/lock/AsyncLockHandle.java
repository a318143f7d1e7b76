package org.sagebionetworks.mutex.lock;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.mutex.redis.AsyncRedisOps;

/**
 * A lock acquired through {@link AsyncRedisLock}.
 * <p>
 * {@link #close()} cannot wait for Redis, so it only requests the release: it hands the key and token to a
 * background task and returns. That release is best effort. It is unordered with respect to anything the caller
 * does next, including re-acquiring the same key, and its failure is only logged. Callers that need the key gone
 * before moving on must call {@link #release()} and wait for the future; close is then a safety net.
 * <p>
 * A handle that is neither released nor closed is never released; its key stays locked until the TTL expires.
 */
public class AsyncLockHandle extends AbstractLockHandle {
    private static final Logger LOG = LoggerFactory.getLogger(AsyncLockHandle.class);

    private final AsyncRedisOps ops;

    AsyncLockHandle(AsyncRedisOps ops, String key, long ttlMillis, String token) {
        super(key, ttlMillis, token);
        this.ops = ops;
    }

    /**
     * Releases the lock if this handle still holds it.
     *
     * @return a future with true if the key was deleted, false if there was nothing of ours to delete; it fails
     *         with {@link ScriptExecutionFailedException} if Redis could not run the release, leaving the handle
     *         held
     */
    public CompletableFuture<Boolean> release() {
        final String token = getToken();
        if (token == null) {
            return CompletableFuture.completedFuture(false);
        }
        return CompareAndDelete.runAsync(ops, getKey(), token).thenApply(deleted -> {
            if (!deleted) {
                LOG.debug("Lock " + getKey() + " expired or changed owner before release; left it alone.");
            }
            clearToken();
            return deleted;
        });
    }

    /**
     * Requests a background release, unless suppressed. The handle counts as released as soon as this returns.
     */
    @Override
    public void close() {
        if (!shouldReleaseOnClose()) {
            return;
        }
        final String key = getKey();
        final String token = getToken();
        clearToken();
        CompareAndDelete.runAsync(ops, key, token).whenComplete((deleted, error) -> {
            if (error != null) {
                Throwable cause = Acquisition.unwrap(error);
                LOG.error("Background release of lock " + key + " failed: " + cause.getMessage(), cause);
            } else if (!deleted) {
                LOG.debug("Lock " + key + " expired or changed owner before background release.");
            }
        });
    }
}
