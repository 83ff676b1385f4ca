package com.taskweave.core.context;

/**
 * Thrown when no persisted context exists for the requested id.
 */
public class ContextNotFoundException extends ContextStateException {

    private final String contextId;

    public ContextNotFoundException(String contextId) {
        super("Context not found: " + contextId);
        this.contextId = contextId;
    }

    public String contextId() {
        return contextId;
    }
}
