package org.sagebionetworks.mutex.redis;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Runs a blocking {@link RedisOps} on a dedicated executor, so callers on an event loop or other cooperative thread
 * never wait on a socket. Jedis has no native async API; the executor should be sized to the connection pool, since
 * each in-flight command holds one pooled connection for its duration.
 */
public class ExecutorAsyncRedisOps implements AsyncRedisOps {

    private final RedisOps ops;
    private final Executor executor;
    // Shut down on close. Null when the executor belongs to the caller.
    private final ExecutorService ownedExecutor;

    /** Runs commands on the caller's executor. Closing this instance leaves the executor running. */
    public ExecutorAsyncRedisOps(RedisOps ops, Executor executor) {
        this(ops, executor, null);
    }

    private ExecutorAsyncRedisOps(RedisOps ops, Executor executor, ExecutorService ownedExecutor) {
        checkNotNull(ops);
        checkNotNull(executor);
        this.ops = ops;
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
    }

    /** Runs commands on an executor created for this instance alone; {@link #close()} shuts it down. */
    static ExecutorAsyncRedisOps owning(RedisOps ops, ExecutorService executor) {
        checkNotNull(executor);
        return new ExecutorAsyncRedisOps(ops, executor, executor);
    }

    @Override
    public CompletableFuture<Boolean> setNxPx(final String key, final String value, final long ttlMillis) {
        return CompletableFuture.supplyAsync(() -> ops.setNxPx(key, value, ttlMillis), executor);
    }

    @Override
    public CompletableFuture<String> get(final String key) {
        return CompletableFuture.supplyAsync(() -> ops.get(key), executor);
    }

    @Override
    public CompletableFuture<Object> eval(final String script, final List<String> keys, final List<String> args) {
        return CompletableFuture.supplyAsync(() -> ops.eval(script, keys, args), executor);
    }

    /**
     * Shuts down the executor if this instance owns it. Commands already submitted, background releases included,
     * still run; later ones are rejected. The wrapped {@link RedisOps} stays open, it is the caller's to close.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }
}
