package com.taskweave.core.invocation;

import java.time.Instant;

/**
 * Raised when a unit's degrade count reaches a multiple of the alert threshold.
 */
public record RepeatedFailureAlert(
    String unit,
    long degradeCount,
    int threshold,
    FailureKind lastFailure,
    Instant timestamp
) {}
