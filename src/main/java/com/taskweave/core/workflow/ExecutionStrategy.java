package com.taskweave.core.workflow;

/**
 * How the steps of a workflow are scheduled.
 */
public enum ExecutionStrategy {
    /** One after another in list order; the first failure aborts the rest. */
    SEQUENTIAL,
    /** Up to max-parallel at once; failures are isolated. */
    PARALLEL,
    /** Like sequential, but each step runs only if its condition holds when it is reached. */
    CONDITIONAL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static ExecutionStrategy fromString(String raw) {
        for (ExecutionStrategy s : values()) {
            if (s.name().equalsIgnoreCase(raw)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown execution strategy: " + raw);
    }
}
