package org.sagebionetworks.mutex.redis;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking forms of the {@link RedisOps} commands the lock issues while acquiring and releasing. Every method
 * returns immediately; the future completes with the reply, or exceptionally with a {@link RedisException}.
 */
public interface AsyncRedisOps extends Closeable {

    /** @see RedisOps#setNxPx(String, String, long) */
    CompletableFuture<Boolean> setNxPx(String key, String value, long ttlMillis);

    /** @see RedisOps#get(String) */
    CompletableFuture<String> get(String key);

    /** @see RedisOps#eval(String, List, List) */
    CompletableFuture<Object> eval(String script, List<String> keys, List<String> args);

    /** Stops accepting commands and frees what this instance owns. */
    @Override
    void close();
}
