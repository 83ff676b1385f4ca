package com.taskweave.core.invocation;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed, immutable account of one {@code invoke} call.
 *
 * @param unit               unit the call was made for
 * @param contextId          workflow context the call read from
 * @param backendAttempted   backend that produced (or last failed to produce) the result
 * @param failureKind        outcome of the call: the primary failure, {@code both_failed} when the
 *                           secondary failed too, null on a primary success
 * @param primaryFailure     classified primary failure, null on a primary success
 * @param retriesUsed        primary retries after the first attempt
 * @param degraded           whether the secondary backend was used
 * @param conversionDegraded whether some artifacts could only be passed to the secondary as text summaries
 * @param duration           wall time of the whole call
 * @param timestamp          when the call finished
 */
public record InvocationRecord(
    String unit,
    String contextId,
    String backendAttempted,
    FailureKind failureKind,
    FailureKind primaryFailure,
    int retriesUsed,
    boolean degraded,
    boolean conversionDegraded,
    Duration duration,
    Instant timestamp
) {

    public boolean primarySucceeded() {
        return !degraded && failureKind == null;
    }

    /** Whether the secondary produced the result. */
    public boolean servedBySecondary() {
        return degraded && failureKind != FailureKind.BOTH_FAILED;
    }
}
