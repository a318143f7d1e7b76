package org.sagebionetworks.mutex.lock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * How many times to try for a contended lock, and how long to wait between tries. There is no wait after the last
 * attempt, so <code>N</code> attempts take <code>N - 1</code> intervals at most.
 */
public final class Retry {

    private static final Retry ONCE = new Retry(1, Duration.ZERO);

    private final int attempts;
    private final Duration interval;

    private Retry(int attempts, Duration interval) {
        this.attempts = attempts;
        this.interval = interval;
    }

    /**
     * @param attempts
     *            total number of attempts, at least 1
     * @param interval
     *            wait between attempts, not negative
     */
    public static Retry of(int attempts, Duration interval) {
        checkArgument(attempts >= 1, "attempts must be at least 1: %s", attempts);
        checkNotNull(interval);
        checkArgument(!interval.isNegative(), "interval must not be negative: %s", interval);
        return new Retry(attempts, interval);
    }

    /** A single attempt. */
    public static Retry once() {
        return ONCE;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Retry)) {
            return false;
        }
        Retry that = (Retry) o;
        return attempts == that.attempts && interval.equals(that.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(attempts, interval);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("attempts", attempts).add("interval", interval).toString();
    }
}
