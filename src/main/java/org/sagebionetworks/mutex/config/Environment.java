package org.sagebionetworks.mutex.config;

/**
 * Runtime environments. Config keys prefixed with the lower-case name, e.g. <code>prod.lock.ttl.millis</code>,
 * override the unprefixed key in that environment.
 */
public enum Environment {
    LOCAL,
    DEV,
    UAT,
    PROD
}
