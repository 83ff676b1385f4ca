package com.taskweave.core.context;

import java.time.Instant;

/**
 * Thrown when a mutation is attempted on a context whose TTL has elapsed.
 * No part of the mutation is applied.
 */
public class ContextExpiredException extends ContextStateException {

    private final String contextId;

    public ContextExpiredException(String contextId, Instant expiredAt) {
        super("Context " + contextId + " expired at " + expiredAt);
        this.contextId = contextId;
    }

    public String contextId() {
        return contextId;
    }
}
