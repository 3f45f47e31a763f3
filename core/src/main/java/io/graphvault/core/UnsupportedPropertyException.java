package io.graphvault.core;

/**
 * Thrown when a property value falls outside the supported value domain
 * (nested maps, nested lists, arbitrary objects).
 */
public class UnsupportedPropertyException extends IllegalArgumentException {
    public UnsupportedPropertyException(String message) {
        super(message);
    }
}
