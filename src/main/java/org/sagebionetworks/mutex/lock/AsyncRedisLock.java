package org.sagebionetworks.mutex.lock;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.mutex.redis.AsyncRedisOps;
import org.sagebionetworks.mutex.redis.RedisException;

/**
 * Non-blocking {@link AsyncLock}. Same protocol as {@link RedisLock}, but no thread ever waits: commands go through
 * {@link AsyncRedisOps} and the pause between attempts is a delayed task rather than a sleep.
 */
public class AsyncRedisLock implements AsyncLock {
    private static final Logger LOG = LoggerFactory.getLogger(AsyncRedisLock.class);

    private final AsyncRedisOps ops;
    private final LockSettings settings;

    public AsyncRedisLock(AsyncRedisOps ops) {
        this(ops, LockSettings.DEFAULTS);
    }

    public AsyncRedisLock(AsyncRedisOps ops, LockSettings settings) {
        checkNotNull(ops);
        checkNotNull(settings);
        this.ops = ops;
        this.settings = settings;
    }

    @Override
    public CompletableFuture<Optional<AsyncLockHandle>> acquire(final String key) {
        return acquire(key, settings.getTtl(), settings.getRetry());
    }

    @Override
    public CompletableFuture<Optional<AsyncLockHandle>> acquire(final String key, final Duration ttl) {
        return acquire(key, ttl, Retry.once());
    }

    @Override
    public CompletableFuture<Optional<AsyncLockHandle>> acquire(final String key, final Duration ttl,
            final Retry retry) {
        final long ttlMillis = Acquisition.ttlMillis(key, ttl);
        checkNotNull(retry);

        final CompletableFuture<Optional<AsyncLockHandle>> result = new CompletableFuture<>();
        attempt(key, ttlMillis, retry, 1, result);
        return result;
    }

    private void attempt(final String key, final long ttlMillis, final Retry retry, final int attempt,
            final CompletableFuture<Optional<AsyncLockHandle>> result) {
        if (result.isDone()) {
            // cancelled by the caller while we were waiting
            LOG.debug("Acquisition of lock " + key + " abandoned before attempt " + attempt + ".");
            return;
        }
        tryOnce(key, ttlMillis).whenComplete((handle, error) -> {
            if (error != null) {
                result.completeExceptionally(Acquisition.unwrap(error));
            } else if (handle != null) {
                if (result.complete(Optional.of(handle))) {
                    LOG.debug("Acquired lock " + key + " on attempt " + attempt + ".");
                } else {
                    LOG.warn("Lock " + key + " was granted after the caller gave up; releasing it.");
                    handle.close();
                }
            } else if (attempt >= retry.getAttempts()) {
                LOG.debug("Lock " + key + " not available after " + attempt + " attempt(s).");
                result.complete(Optional.empty());
            } else {
                delay(retry.getInterval()).execute(() -> attempt(key, ttlMillis, retry, attempt + 1, result));
            }
        });
    }

    // One SET NX with a fresh token. Completes with null if the key is taken.
    private CompletableFuture<AsyncLockHandle> tryOnce(final String key, final long ttlMillis) {
        final String token = FencingTokens.next();
        CompletableFuture<Boolean> written;
        try {
            written = ops.setNxPx(key, token, ttlMillis);
        } catch (RuntimeException ex) {
            written = CompletableFuture.failedFuture(ex);
        }
        return written.handle((acquired, error) -> {
            if (error == null) {
                return CompletableFuture.completedFuture(Boolean.TRUE.equals(acquired));
            }
            final Throwable cause = Acquisition.unwrap(error);
            if (cause instanceof RedisException) {
                return confirm(key, token, (RedisException) cause);
            }
            return CompletableFuture.<Boolean>failedFuture(cause);
        }).thenCompose(Function.identity())
                .thenApply(acquired -> acquired ? new AsyncLockHandle(ops, key, ttlMillis, token) : null);
    }

    private CompletableFuture<Boolean> confirm(final String key, final String token,
            final RedisException writeError) {
        CompletableFuture<String> read;
        try {
            read = ops.get(key);
        } catch (RuntimeException ex) {
            read = CompletableFuture.failedFuture(ex);
        }
        return read.handle((observed, error) -> {
            if (error != null) {
                throw Acquisition.confirmFailed(Acquisition.unwrap(error), writeError);
            }
            return Acquisition.confirm(key, token, observed, writeError);
        });
    }

    /** Executor that runs the next attempt after the interval. Package-scoped so tests can skip the waits. */
    Executor delay(final Duration interval) {
        return CompletableFuture.delayedExecutor(interval.toMillis(), TimeUnit.MILLISECONDS);
    }
}
