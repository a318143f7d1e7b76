package org.sagebionetworks.mutex.config;

@SuppressWarnings("serial")
public class InvalidEnvironmentException extends RuntimeException {

    public InvalidEnvironmentException(final String envName) {
        super("Invalid environment '" + envName + "'; expected one of local, dev, uat, prod.");
    }
}
