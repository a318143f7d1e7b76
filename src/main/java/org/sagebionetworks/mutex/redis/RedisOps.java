package org.sagebionetworks.mutex.redis;

import java.io.Closeable;
import java.util.List;

/**
 * The blocking subset of Redis commands the lock depends on. Implementations must be safe for concurrent use, since
 * one instance is shared by every lock in the process. Close it once no lock uses it any more.
 */
public interface RedisOps extends Closeable {

    /**
     * <code>SET key value NX PX ttlMillis</code>. Atomically creates the key with a millisecond expiry if, and only
     * if, it does not exist yet.
     *
     * @return true if the key was set, false if it already existed
     */
    boolean setNxPx(String key, String value, long ttlMillis);

    /** Gets the value of the specified key, or null if the key does not exist. */
    String get(String key);

    /**
     * Remaining time to live of the key in milliseconds.
     *
     * @return the ttl, -1 if the key exists without expiry, -2 if the key does not exist
     */
    long pttl(String key);

    /**
     * Runs a Lua script atomically on the server.
     *
     * @return the raw script reply, a Long for integer replies
     */
    Object eval(String script, List<String> keys, List<String> args);

    /** Round trip to the server; returns "PONG" when healthy. */
    String ping();

    /** Closes the connections this instance owns. */
    @Override
    void close();
}
