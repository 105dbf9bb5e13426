package com.debstats.statistics.model;

/**
 * Thrown when the requested number of packages is negative or not a number.
 */
public class InvalidSelectionException extends IllegalArgumentException {

    public InvalidSelectionException(String message) {
        super(message);
    }

    public InvalidSelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
