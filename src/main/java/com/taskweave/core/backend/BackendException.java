package com.taskweave.core.backend;

import com.taskweave.core.invocation.FailureKind;

/**
 * Failure raised by a backend that already knows which {@link FailureKind} it is.
 * Backends may also throw arbitrary exceptions; those are classified by the
 * invocation controller.
 */
public class BackendException extends RuntimeException {

    private final FailureKind kind;

    public BackendException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
