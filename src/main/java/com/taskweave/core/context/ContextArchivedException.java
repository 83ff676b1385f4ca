package com.taskweave.core.context;

/**
 * Thrown when a mutation is attempted on an archived (read-only) context.
 */
public class ContextArchivedException extends ContextStateException {
    public ContextArchivedException(String contextId) {
        super("Context " + contextId + " is archived and read-only");
    }
}
