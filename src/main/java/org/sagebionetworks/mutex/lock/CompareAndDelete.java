package org.sagebionetworks.mutex.lock;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.google.common.collect.ImmutableList;

import org.sagebionetworks.mutex.redis.AsyncRedisOps;
import org.sagebionetworks.mutex.redis.RedisException;
import org.sagebionetworks.mutex.redis.RedisOps;

/**
 * Atomic compare-and-delete of a lock key. The check and the delete run as one Lua script on the server, so a key
 * that expired and was re-acquired by another client between the two steps can never be deleted by the old holder.
 */
public final class CompareAndDelete {

    /** Deletes KEYS[1] only if its value is ARGV[1]. Replies 1 if deleted, 0 otherwise. */
    public static final String SCRIPT =
            "if redis.call(\"GET\", KEYS[1]) == ARGV[1] then\n" +
            "    return redis.call(\"DEL\", KEYS[1])\n" +
            "else\n" +
            "    return 0\n" +
            "end";

    private CompareAndDelete() {
    }

    /**
     * Runs the script.
     *
     * @return true if the key was deleted, false if it had expired or holds another token
     * @throws ScriptExecutionFailedException if the script could not run
     */
    static boolean run(final RedisOps ops, final String key, final String token) {
        try {
            return deleted(ops.eval(SCRIPT, keys(key), args(token)));
        } catch (RedisException ex) {
            throw new ScriptExecutionFailedException(key, ex);
        }
    }

    /**
     * Non-blocking {@link #run(RedisOps, String, String)}. The future fails with
     * {@link ScriptExecutionFailedException} if the script could not run.
     */
    static CompletableFuture<Boolean> runAsync(final AsyncRedisOps ops, final String key, final String token) {
        CompletableFuture<Object> reply;
        try {
            reply = ops.eval(SCRIPT, keys(key), args(token));
        } catch (RuntimeException ex) {
            // e.g. the command executor rejected the task
            reply = CompletableFuture.failedFuture(ex);
        }
        return reply.handle((result, error) -> {
            if (error != null) {
                throw new ScriptExecutionFailedException(key, Acquisition.unwrap(error));
            }
            return deleted(result);
        });
    }

    private static List<String> keys(String key) {
        return ImmutableList.of(key);
    }

    private static List<String> args(String token) {
        return ImmutableList.of(token);
    }

    private static boolean deleted(Object reply) {
        return reply instanceof Long && (Long) reply == 1L;
    }
}
