package com.taskweave.core.context;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Versioning and lifetime information of a {@link WorkflowContext}.
 * {@code version} is advanced only by the context itself.
 */
public record ContextMetadata(
    Instant createdAt,
    Instant updatedAt,
    long version,
    Duration ttl,
    String owner,
    Priority priority
) implements Serializable {

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }
}
