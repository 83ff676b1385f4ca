package com.taskweave.core.health;

/**
 * One entry of the readiness battery run by {@link HealthEvaluator}.
 */
public interface HealthCheck {

    String name();

    HealthStatus check();

    /** Whether a critical result of this check blocks attempts on the primary backend. */
    default boolean relevantToPrimary() {
        return true;
    }

    /** Whether a critical result of this check blocks the secondary backend. */
    default boolean relevantToSecondary() {
        return false;
    }
}
