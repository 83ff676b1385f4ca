package com.taskweave.core.invocation;

import java.util.Map;

/**
 * What {@code invoke} returns. The output has the same shape whether it came
 * from the primary or the secondary backend; only {@link #record()} tells them apart.
 */
public record InvocationResult(Map<String, Object> output, InvocationRecord record) {

    public boolean degraded() {
        return record.degraded();
    }
}
