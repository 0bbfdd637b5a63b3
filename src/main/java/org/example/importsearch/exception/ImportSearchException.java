package org.example.importsearch.exception;

/**
 * Base exception for all import search errors.
 */
public class ImportSearchException extends Exception {

    public ImportSearchException(String message) {
        super(message);
    }

    public ImportSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
