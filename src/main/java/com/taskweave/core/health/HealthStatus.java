package com.taskweave.core.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Verdict of one health check.
 */
public record HealthStatus(
    String check,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public enum Status {
        HEALTHY, WARNING, CRITICAL;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }

        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public static HealthStatus healthy(String check, String detail) {
        return new HealthStatus(check, Status.HEALTHY, detail, Map.of());
    }

    public static HealthStatus warning(String check, String detail) {
        return new HealthStatus(check, Status.WARNING, detail, Map.of());
    }

    public static HealthStatus critical(String check, String detail) {
        return new HealthStatus(check, Status.CRITICAL, detail, Map.of());
    }

    public HealthStatus withMetadata(Map<String, String> values) {
        return new HealthStatus(check, status, detail, values);
    }
}
