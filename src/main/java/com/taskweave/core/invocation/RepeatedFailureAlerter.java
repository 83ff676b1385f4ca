package com.taskweave.core.invocation;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Counts degrades per unit and decides when to alert.
 * <p>
 * The counter is never reset by an alert: an alert fires each time the count
 * reaches a multiple of the threshold (3, 6, 9, ... for a threshold of 3).
 * Only {@link #reset()} clears it.
 */
public class RepeatedFailureAlerter {

    private final int threshold;
    private final Map<String, Long> degradeCounts = new HashMap<>();

    public RepeatedFailureAlerter(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("alert threshold must be >= 1");
        }
        this.threshold = threshold;
    }

    public int threshold() {
        return threshold;
    }

    public synchronized Optional<RepeatedFailureAlert> onDegrade(String unit, FailureKind kind, Instant now) {
        long count = degradeCounts.merge(unit, 1L, Long::sum);
        if (count % threshold == 0) {
            return Optional.of(new RepeatedFailureAlert(unit, count, threshold, kind, now));
        }
        return Optional.empty();
    }

    public synchronized long degradeCount(String unit) {
        return degradeCounts.getOrDefault(unit, 0L);
    }

    public synchronized void reset() {
        degradeCounts.clear();
    }
}
