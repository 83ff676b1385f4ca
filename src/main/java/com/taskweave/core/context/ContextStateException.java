package com.taskweave.core.context;

/**
 * Base type for failures caused by the state of a context rather than by I/O.
 */
public class ContextStateException extends RuntimeException {
    public ContextStateException(String message) {
        super(message);
    }
}
