package org.unicitylabs.hydrator.config;

/**
 * Fatal configuration problem: unreadable or invalid YAML, or no relay to talk to.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
