package org.netpreserve.fedicrawl.config;

/**
 * An invalid configuration value or a malformed operator-supplied entry such as a proxy URI.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
