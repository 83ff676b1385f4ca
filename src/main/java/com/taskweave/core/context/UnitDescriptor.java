package com.taskweave.core.context;

import java.io.Serializable;
import java.time.Instant;

/**
 * Point-in-time view of a unit's bookkeeping, as recorded in the context.
 *
 * @param name        unit name, unique within a workflow run
 * @param state       current lifecycle state
 * @param startedAt   when the unit entered {@link UnitState#RUNNING} (null before that)
 * @param completedAt when the unit reached a terminal state (null before that)
 * @param error       last error message when {@link UnitState#FAILED}
 * @param retryCount  retries consumed so far (first attempt excluded)
 */
public record UnitDescriptor(
    String name,
    UnitState state,
    Instant startedAt,
    Instant completedAt,
    String error,
    int retryCount
) implements Serializable {

    public static UnitDescriptor initialized(String name) {
        return new UnitDescriptor(name, UnitState.INITIALIZED, null, null, null, 0);
    }
}
