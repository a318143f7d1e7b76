package org.sagebionetworks.mutex.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking distributed lock. The futures complete with an empty optional when the lock is held by someone else,
 * and fail with a {@link org.sagebionetworks.mutex.redis.RedisException} when Redis could not tell.
 * <p>
 * Cancelling a returned future stops further attempts. A lock that is granted anyway, because its command was
 * already in flight, is released in the background.
 */
public interface AsyncLock {

    /** @see Lock#acquire(String) */
    CompletableFuture<Optional<AsyncLockHandle>> acquire(String key);

    /** @see Lock#acquire(String, Duration) */
    CompletableFuture<Optional<AsyncLockHandle>> acquire(String key, Duration ttl);

    /** @see Lock#acquire(String, Duration, Retry) */
    CompletableFuture<Optional<AsyncLockHandle>> acquire(String key, Duration ttl, Retry retry);
}
