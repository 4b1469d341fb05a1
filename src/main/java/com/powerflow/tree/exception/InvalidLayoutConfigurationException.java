package com.powerflow.tree.exception;

/**
 * Thrown before traversal starts when a layout spacing constant is not positive.
 */
public class InvalidLayoutConfigurationException extends RuntimeException {

    public InvalidLayoutConfigurationException(String message) {
        super(message);
    }
}
