package org.sagebionetworks.mutex.lock;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.mutex.redis.RedisException;
import org.sagebionetworks.mutex.redis.RedisOps;

/**
 * Blocking {@link Lock} on a single logical Redis endpoint. Each attempt writes a fresh fencing token with
 * <code>SET NX PX</code>; the first writer wins. Retry waits sleep the calling thread.
 * <p>
 * If the write fails in transit, one <code>GET</code> checks whether it landed anyway. Only seeing our own token
 * counts as acquired; everything else surfaces as {@link AmbiguousWriteOutcomeException}.
 */
public class RedisLock implements Lock {
    private static final Logger LOG = LoggerFactory.getLogger(RedisLock.class);

    private final RedisOps ops;
    private final LockSettings settings;

    public RedisLock(RedisOps ops) {
        this(ops, LockSettings.DEFAULTS);
    }

    public RedisLock(RedisOps ops, LockSettings settings) {
        checkNotNull(ops);
        checkNotNull(settings);
        this.ops = ops;
        this.settings = settings;
    }

    @Override
    public Optional<LockHandle> acquire(final String key) {
        return acquire(key, settings.getTtl(), settings.getRetry());
    }

    @Override
    public Optional<LockHandle> acquire(final String key, final Duration ttl) {
        return acquire(key, ttl, Retry.once());
    }

    /**
     * If the thread is interrupted while waiting between attempts, the remaining attempts are given up: the
     * interrupt flag is restored and the result is empty.
     */
    @Override
    public Optional<LockHandle> acquire(final String key, final Duration ttl, final Retry retry) {
        final long ttlMillis = Acquisition.ttlMillis(key, ttl);
        checkNotNull(retry);

        for (int attempt = 1; attempt <= retry.getAttempts(); attempt++) {
            LockHandle handle = tryOnce(key, ttlMillis);
            if (handle != null) {
                LOG.debug("Acquired lock " + key + " on attempt " + attempt + ".");
                return Optional.of(handle);
            }
            if (attempt < retry.getAttempts()) {
                try {
                    sleep(retry.getInterval());
                } catch (InterruptedException ex) {
                    LOG.warn("Interrupted while waiting for lock " + key + ", giving up after attempt " + attempt
                            + ": " + ex.getMessage(), ex);
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
        }
        LOG.debug("Lock " + key + " not available after " + retry.getAttempts() + " attempt(s).");
        return Optional.empty();
    }

    // One SET NX with a fresh token. Returns null if the key is taken.
    private LockHandle tryOnce(final String key, final long ttlMillis) {
        final String token = FencingTokens.next();
        boolean acquired;
        try {
            acquired = ops.setNxPx(key, token, ttlMillis);
        } catch (RedisException ex) {
            acquired = confirm(key, token, ex);
        }
        return acquired ? new LockHandle(ops, key, ttlMillis, token) : null;
    }

    private boolean confirm(final String key, final String token, final RedisException writeError) {
        final String observed;
        try {
            observed = ops.get(key);
        } catch (RuntimeException ex) {
            throw Acquisition.confirmFailed(ex, writeError);
        }
        return Acquisition.confirm(key, token, observed, writeError);
    }

    /** Waits between attempts. Package-scoped so tests can observe the waits. */
    void sleep(final Duration interval) throws InterruptedException {
        Thread.sleep(interval.toMillis());
    }
}
