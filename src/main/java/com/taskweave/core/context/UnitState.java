package com.taskweave.core.context;

/**
 * Lifecycle of a single unit of work.
 * <p>
 * {@code INITIALIZED -> RUNNING -> COMPLETED | FAILED}; both end states are terminal.
 */
public enum UnitState {
    INITIALIZED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
