package org.sagebionetworks.mutex.lock;

import com.google.common.base.MoreObjects;

/**
 * State of one held lock: the key, its lease, and the fencing token written at the key. A handle is created holding
 * its token; the token is cleared once the lock is released and never replaced by another. One handle belongs to
 * one owner and is not meant to be shared between threads; the token is volatile only because non-blocking release
 * clears it from a completion thread.
 * <p>
 * Handles are {@link AutoCloseable}: closing releases the lock unless {@link #suppressAutoRelease()} was called.
 * Closing never throws. Scope-bound release needs try-with-resources or an explicit close; a handle that is just
 * dropped keeps its key until the TTL expires.
 */
public abstract class AbstractLockHandle implements AutoCloseable {

    private final String key;
    private final long ttlMillis;
    private volatile String token;
    private boolean autoReleaseSuppressed;

    AbstractLockHandle(String key, long ttlMillis, String token) {
        this.key = key;
        this.ttlMillis = ttlMillis;
        this.token = token;
    }

    /** The locked key. */
    public String getKey() {
        return key;
    }

    /** The lease the lock was acquired with. */
    public long getTtlMillis() {
        return ttlMillis;
    }

    /** The fencing token, or null once released. */
    public String getToken() {
        return token;
    }

    /**
     * True until the lock is released through this handle. A held handle may still have lost the key to TTL expiry;
     * only the store knows.
     */
    public boolean isHeld() {
        return token != null;
    }

    /**
     * Stops {@link #close()} from releasing the lock. Use when the lock must outlive this scope, e.g. when the token
     * is handed to another process; the lock is then freed by an explicit release or by TTL expiry.
     */
    public void suppressAutoRelease() {
        this.autoReleaseSuppressed = true;
    }

    public boolean isAutoReleaseSuppressed() {
        return autoReleaseSuppressed;
    }

    final void clearToken() {
        this.token = null;
    }

    // True if close() has something to do.
    final boolean shouldReleaseOnClose() {
        return !autoReleaseSuppressed && token != null;
    }

    @Override
    public abstract void close();

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("key", key).add("ttlMillis", ttlMillis).add("held", isHeld())
                .add("autoReleaseSuppressed", autoReleaseSuppressed).toString();
    }
}
