package com.taskweave.core.invocation;

/**
 * Raised immediately, without retry or degrade, when the task input is malformed.
 */
public class InvocationValidationException extends RuntimeException {

    public InvocationValidationException(String message) {
        super(message);
    }

    public InvocationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
