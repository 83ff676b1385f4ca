package com.taskweave.core.workflow;

public enum WorkflowStatus {
    /** No unit failed and the run was not cancelled. */
    COMPLETED,
    /** Some units completed, and others failed or were cut short by cancellation. */
    PARTIAL,
    /** Nothing completed, through failure or cancellation. */
    FAILED;

    public String wireName() {
        return name().toLowerCase();
    }

    static WorkflowStatus of(int completed, int failed, boolean cancelled) {
        if (failed == 0 && !cancelled) {
            return COMPLETED;
        }
        return completed == 0 ? FAILED : PARTIAL;
    }
}
