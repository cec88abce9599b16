package com.repo.scopemetrics.ast;

/**
 * Thrown when an input document is unreadable or is not an ESTree program.
 */
public class EstreeFormatException extends RuntimeException {

    public EstreeFormatException(String message) {
        super(message);
    }

    public EstreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
