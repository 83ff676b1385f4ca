package com.taskweave.core.context;

import java.io.Serializable;
import java.time.Instant;

/**
 * Audit entry written every time an invocation falls back to the secondary backend.
 *
 * @param unit        unit whose invocation degraded
 * @param failureKind wire name of the classified failure, e.g. "timeout"
 * @param degradedTo  name of the backend that served the request instead
 * @param timestamp   when the degrade happened
 */
public record DegradationRecord(
    String unit,
    String failureKind,
    String degradedTo,
    Instant timestamp
) implements Serializable {}
