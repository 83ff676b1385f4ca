package com.taskweave.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator backed by the readiness battery.
 * Down when neither backend is ready; "DEGRADED" when only the secondary is ready
 * or some check reports a warning.
 */
@Component
public class ReadinessHealthIndicator implements HealthIndicator {

    private final HealthEvaluator evaluator;

    public ReadinessHealthIndicator(HealthEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Health health() {
        HealthReport report = evaluator.currentReport();
        Health.Builder builder;
        if (!report.readyForPrimary() && !report.readyForSecondary()) {
            builder = Health.down();
        } else if (!report.readyForPrimary() || report.overall() != HealthStatus.Status.HEALTHY) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.up();
        }
        builder.withDetail("readyForPrimary", report.readyForPrimary())
                .withDetail("readyForSecondary", report.readyForSecondary());
        for (var entry : report.checks().entrySet()) {
            builder.withDetail(entry.getKey(), entry.getValue().status().wireName() + ": " + entry.getValue().detail());
        }
        return builder.build();
    }
}
