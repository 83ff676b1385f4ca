package com.taskweave.core.invocation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running counters of one controller, shared by concurrent invocations.
 * Degraded invocations are those the secondary answered; a call where both
 * backends failed counts under {@code both_failed} and under its primary
 * failure kind, but not as degraded.
 * Counters only grow until {@link #reset()}; a bounded history of the most
 * recent records is kept alongside.
 */
public class InvocationStatistics {

    private final int historySize;

    private long totalInvocations;
    private long primarySuccesses;
    private long primaryFailures;
    private long degradedInvocations;
    private long alertsRaised;
    private final Map<String, Long> failureKindCounts = new TreeMap<>();
    private final Map<String, Long> unitFailureCounts = new TreeMap<>();
    private final Deque<InvocationRecord> history = new ArrayDeque<>();

    public InvocationStatistics(int historySize) {
        this.historySize = Math.max(0, historySize);
    }

    public synchronized void record(InvocationRecord record) {
        totalInvocations++;
        if (record.primarySucceeded()) {
            primarySuccesses++;
        } else {
            primaryFailures++;
            unitFailureCounts.merge(record.unit(), 1L, Long::sum);
        }
        if (record.servedBySecondary()) {
            degradedInvocations++;
        }
        if (record.failureKind() != null) {
            failureKindCounts.merge(record.failureKind().wireName(), 1L, Long::sum);
        }
        if (record.primaryFailure() != null && record.primaryFailure() != record.failureKind()) {
            failureKindCounts.merge(record.primaryFailure().wireName(), 1L, Long::sum);
        }
        if (record.conversionDegraded()) {
            failureKindCounts.merge(FailureKind.CONTEXT_CONVERSION_FAILURE.wireName(), 1L, Long::sum);
        }
        if (historySize > 0) {
            history.addLast(record);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    public synchronized void recordAlert() {
        alertsRaised++;
    }

    public synchronized StatisticsSnapshot snapshot() {
        double fallbackRate = totalInvocations == 0 ? 0.0 : (double) degradedInvocations / totalInvocations;
        double successRate = totalInvocations == 0 ? 0.0 : (double) primarySuccesses / totalInvocations;
        return new StatisticsSnapshot(totalInvocations, primarySuccesses, primaryFailures, degradedInvocations,
                fallbackRate, successRate, Map.copyOf(failureKindCounts), Map.copyOf(unitFailureCounts), alertsRaised);
    }

    /**
     * Most recent records, oldest first.
     */
    public synchronized List<InvocationRecord> recentRecords() {
        return List.copyOf(history);
    }

    public synchronized void reset() {
        totalInvocations = 0;
        primarySuccesses = 0;
        primaryFailures = 0;
        degradedInvocations = 0;
        alertsRaised = 0;
        failureKindCounts.clear();
        unitFailureCounts.clear();
        history.clear();
    }
}
