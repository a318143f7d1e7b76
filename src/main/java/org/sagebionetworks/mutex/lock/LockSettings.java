package org.sagebionetworks.mutex.lock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;

import com.google.common.base.MoreObjects;

import org.sagebionetworks.mutex.config.Config;

/** Defaults used by <code>acquire(key)</code>, and the size of the async command pool. */
public final class LockSettings {

    static final String TTL_KEY = "lock.ttl.millis";
    static final String RETRY_ATTEMPTS_KEY = "lock.retry.attempts";
    static final String RETRY_INTERVAL_KEY = "lock.retry.interval.millis";
    static final String ASYNC_THREADS_KEY = "lock.async.threads";

    /** 10 second lease, a single attempt, 4 async threads. */
    public static final LockSettings DEFAULTS = new LockSettings(Duration.ofSeconds(10), Retry.once(), 4);

    private final Duration ttl;
    private final Retry retry;
    private final int asyncThreads;

    public LockSettings(Duration ttl, Retry retry, int asyncThreads) {
        checkNotNull(ttl);
        checkNotNull(retry);
        checkArgument(ttl.toMillis() > 0, "ttl must be at least 1ms: %s", ttl);
        checkArgument(asyncThreads > 0, "asyncThreads must be positive: %s", asyncThreads);
        this.ttl = ttl;
        this.retry = retry;
        this.asyncThreads = asyncThreads;
    }

    /** Reads the <code>lock.*</code> entries. All of them are required. */
    public static LockSettings fromConfig(Config config) {
        checkNotNull(config);
        return new LockSettings(Duration.ofMillis(config.getLong(TTL_KEY)),
                Retry.of(config.getInt(RETRY_ATTEMPTS_KEY), Duration.ofMillis(config.getLong(RETRY_INTERVAL_KEY))),
                config.getInt(ASYNC_THREADS_KEY));
    }

    public Duration getTtl() {
        return ttl;
    }

    public Retry getRetry() {
        return retry;
    }

    public int getAsyncThreads() {
        return asyncThreads;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("ttl", ttl).add("retry", retry)
                .add("asyncThreads", asyncThreads).toString();
    }
}
