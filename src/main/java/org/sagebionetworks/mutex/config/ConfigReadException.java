package org.sagebionetworks.mutex.config;

/** An environment variable or system property could not be read, usually because a security manager denied it. */
@SuppressWarnings("serial")
public class ConfigReadException extends RuntimeException {

    public ConfigReadException(final String source, final String name, final Throwable cause) {
        super("Cannot read " + source + " '" + name + "'.", cause);
    }
}
