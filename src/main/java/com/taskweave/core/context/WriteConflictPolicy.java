package com.taskweave.core.context;

/**
 * How a {@link WorkflowContext} treats two units writing the same artifact key
 * inside one parallel section.
 */
public enum WriteConflictPolicy {
    /** The write with the higher version wins; nothing is merged. */
    LAST_WRITE_WINS,
    /** The second writer fails with {@link WriteConflictException}. */
    REJECT
}
