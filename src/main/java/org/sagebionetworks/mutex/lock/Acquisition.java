package org.sagebionetworks.mutex.lock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.mutex.redis.RedisException;

/** Decisions shared by the blocking and the non-blocking acquisition paths. */
final class Acquisition {
    private static final Logger LOG = LoggerFactory.getLogger(Acquisition.class);

    private Acquisition() {
    }

    /** Validates the arguments of an acquisition and returns the ttl in milliseconds. */
    static long ttlMillis(final String key, final Duration ttl) {
        checkArgument(!Strings.isNullOrEmpty(key), "key must not be empty");
        checkNotNull(ttl);
        final long ttlMillis = ttl.toMillis();
        checkArgument(ttlMillis > 0, "ttl must be at least 1ms: %s", ttl);
        return ttlMillis;
    }

    /**
     * Settles an attempt whose <code>SET NX</code> failed in transit, given what the corrective <code>GET</code>
     * observed. Our own token at the key means the write landed and the lock is ours. Anything else is unknown.
     *
     * @return true, the lock is held
     * @throws AmbiguousWriteOutcomeException if the observed value is not our token
     */
    static boolean confirm(final String key, final String token, final String observed,
            final RedisException writeError) {
        if (token.equals(observed)) {
            LOG.warn("SET NX for lock " + key + " failed but the write landed; lock is held: "
                    + writeError.getMessage());
            return true;
        }
        throw new AmbiguousWriteOutcomeException(key, writeError);
    }

    /**
     * Called when the corrective GET itself fails. That is a hard error, carrying the write error as suppressed.
     * A client may fail both commands with the same exception instance, which cannot suppress itself.
     */
    static RuntimeException confirmFailed(final Throwable readError, final RedisException writeError) {
        if (readError != writeError) {
            readError.addSuppressed(writeError);
        }
        if (readError instanceof RuntimeException) {
            return (RuntimeException) readError;
        }
        return new CompletionException(readError);
    }

    /** Strips the wrappers futures put around the real failure. */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
