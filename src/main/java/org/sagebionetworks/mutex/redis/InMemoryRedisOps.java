package org.sagebionetworks.mutex.redis;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Ticker;

import org.sagebionetworks.mutex.lock.CompareAndDelete;

/**
 * In-memory implementation of {@link RedisOps}, for tests and local runs. Unlike the real server it only understands
 * the one Lua script the lock uses. Expiry is honored lazily against the supplied {@link Ticker}, so tests can move
 * time forward without sleeping. All methods are synchronized, which makes each command atomic like on the server.
 */
public class InMemoryRedisOps implements RedisOps {

    private static final class Entry {
        final String value;
        // Ticker nanos at which the entry expires, or Long.MAX_VALUE for no expiry.
        final long expiresAtNanos;

        Entry(String value, long expiresAtNanos) {
            this.value = value;
            this.expiresAtNanos = expiresAtNanos;
        }
    }

    private final Map<String, Entry> map = new HashMap<>();
    private final Ticker ticker;

    public InMemoryRedisOps() {
        this(Ticker.systemTicker());
    }

    public InMemoryRedisOps(Ticker ticker) {
        checkNotNull(ticker);
        this.ticker = ticker;
    }

    @Override
    public synchronized boolean setNxPx(String key, String value, long ttlMillis) {
        if (live(key) != null) {
            return false;
        }
        map.put(key, new Entry(value, ticker.read() + TimeUnit.MILLISECONDS.toNanos(ttlMillis)));
        return true;
    }

    @Override
    public synchronized String get(String key) {
        Entry entry = live(key);
        return entry == null ? null : entry.value;
    }

    @Override
    public synchronized long pttl(String key) {
        Entry entry = live(key);
        if (entry == null) {
            return -2L;
        }
        if (entry.expiresAtNanos == Long.MAX_VALUE) {
            return -1L;
        }
        return TimeUnit.NANOSECONDS.toMillis(entry.expiresAtNanos - ticker.read());
    }

    @Override
    public synchronized Object eval(String script, List<String> keys, List<String> args) {
        if (!CompareAndDelete.SCRIPT.equals(script)) {
            throw new UnsupportedOperationException("Unsupported script: " + script);
        }
        String key = keys.get(0);
        Entry entry = live(key);
        if (entry != null && entry.value.equals(args.get(0))) {
            map.remove(key);
            return 1L;
        }
        return 0L;
    }

    @Override
    public String ping() {
        return "PONG";
    }

    @Override
    public void close() {
        // nothing to free
    }

    /** Plain <code>SET</code> without expiry. Lets tests play a third party overwriting a lock key. */
    public synchronized void set(String key, String value) {
        map.put(key, new Entry(value, Long.MAX_VALUE));
    }

    /** Plain <code>DEL</code>. Lets tests play a third party deleting a lock key. */
    public synchronized boolean del(String key) {
        return live(key) != null && map.remove(key) != null;
    }

    // Returns the entry if it has not expired yet; expired entries are evicted on access.
    private Entry live(String key) {
        Entry entry = map.get(key);
        if (entry != null && entry.expiresAtNanos <= ticker.read()) {
            map.remove(key);
            return null;
        }
        return entry;
    }
}
