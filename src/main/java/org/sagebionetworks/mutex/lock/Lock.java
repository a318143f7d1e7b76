package org.sagebionetworks.mutex.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocking distributed lock. Every method returns an empty optional when the lock is held by someone else, and
 * throws a {@link org.sagebionetworks.mutex.redis.RedisException} when Redis could not tell.
 */
public interface Lock {

    /**
     * Tries to acquire a lock for the specified key with the configured default lease and retry policy.
     *
     * @param key  The key to lock on.
     * @return The handle needed to release the lock, or empty if the lock is not available.
     */
    Optional<LockHandle> acquire(String key);

    /**
     * Tries once to acquire a lock for the specified key.
     *
     * @param key  The key to lock on.
     * @param ttl  The lock will expire after the specified amount of time.
     * @return The handle needed to release the lock, or empty if the lock is not available.
     */
    Optional<LockHandle> acquire(String key, Duration ttl);

    /**
     * Tries to acquire a lock for the specified key, waiting between attempts while it is held by someone else.
     * A Redis error ends the attempts immediately.
     *
     * @param key    The key to lock on.
     * @param ttl    The lock will expire after the specified amount of time.
     * @param retry  Number of attempts and the wait between them.
     * @return The handle needed to release the lock, or empty if the lock stayed unavailable.
     */
    Optional<LockHandle> acquire(String key, Duration ttl, Retry retry);
}
