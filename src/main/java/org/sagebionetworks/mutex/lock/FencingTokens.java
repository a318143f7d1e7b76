package org.sagebionetworks.mutex.lock;

import java.util.UUID;

/** Source of fencing tokens, the values written into lock keys. */
public final class FencingTokens {

    private FencingTokens() {
    }

    /**
     * A fresh token for one acquisition attempt. Random UUIDs come from <code>SecureRandom</code>, so a token can
     * neither be guessed nor collide with another client's.
     */
    public static String next() {
        return UUID.randomUUID().toString();
    }
}
