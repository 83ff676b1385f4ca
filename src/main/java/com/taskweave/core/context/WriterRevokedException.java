package com.taskweave.core.context;

/**
 * Raised when a unit attempt keeps writing after its writer grant was revoked,
 * typically because the attempt timed out.
 */
public class WriterRevokedException extends ContextStateException {
    public WriterRevokedException(String contextId, String writer) {
        super("Writer " + writer + " no longer has access to context " + contextId);
    }
}
