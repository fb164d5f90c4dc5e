package org.orderedindex;

/**
 * Thrown when an index is configured with parameters it cannot work with.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}
