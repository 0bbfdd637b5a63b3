package org.example.importsearch.exception;

/**
 * Exception thrown when writing search results to their destination fails.
 */
public class OutputException extends ImportSearchException {

    public OutputException(String message) {
        super(message);
    }

    public OutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
