package com.taskweave.core.persistence;

/**
 * Thrown when context bytes cannot be written, read or decoded.
 */
public class ContextPersistenceException extends RuntimeException {
    public ContextPersistenceException(String message) {
        super(message);
    }

    public ContextPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
