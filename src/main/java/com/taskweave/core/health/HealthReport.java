package com.taskweave.core.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduced result of a full health battery.
 *
 * @param checks            per-check verdicts, in battery order
 * @param overall           worst status across all checks
 * @param readyForPrimary   no critical check among those relevant to the primary backend
 * @param readyForSecondary no critical check among those relevant to the secondary backend
 * @param evaluatedAt       when the battery ran
 */
public record HealthReport(
    Map<String, HealthStatus> checks,
    HealthStatus.Status overall,
    boolean readyForPrimary,
    boolean readyForSecondary,
    Instant evaluatedAt
) {

    public HealthReport {
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    static HealthReport reduce(List<HealthCheck> battery, List<HealthStatus> results, Instant evaluatedAt) {
        var checks = new LinkedHashMap<String, HealthStatus>();
        HealthStatus.Status overall = HealthStatus.Status.HEALTHY;
        boolean primary = true;
        boolean secondary = true;
        for (int i = 0; i < battery.size(); i++) {
            HealthCheck check = battery.get(i);
            HealthStatus result = results.get(i);
            checks.put(check.name(), result);
            overall = overall.worse(result.status());
            if (result.status() == HealthStatus.Status.CRITICAL) {
                primary &= !check.relevantToPrimary();
                secondary &= !check.relevantToSecondary();
            }
        }
        return new HealthReport(checks, overall, primary, secondary, evaluatedAt);
    }

    public List<HealthStatus> failing() {
        return checks.values().stream()
                .filter(s -> s.status() != HealthStatus.Status.HEALTHY)
                .toList();
    }
}
