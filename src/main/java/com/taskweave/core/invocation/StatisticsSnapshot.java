package com.taskweave.core.invocation;

import java.util.Map;

/**
 * Read-only view of {@link InvocationStatistics} at one point in time.
 * {@code fallbackRate} and {@code primarySuccessRate} are fractions of
 * {@code totalInvocations}, 0 when nothing has been invoked.
 */
public record StatisticsSnapshot(
    long totalInvocations,
    long primarySuccesses,
    long primaryFailures,
    long degradedInvocations,
    double fallbackRate,
    double primarySuccessRate,
    Map<String, Long> failureKindCounts,
    Map<String, Long> unitFailureCounts,
    long alertsRaised
) {}
