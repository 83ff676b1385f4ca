package com.taskweave.core.health;

import com.taskweave.core.backend.Backend;
import com.taskweave.core.backend.PrimaryBackend;

/**
 * Critical when a backend cannot be found locally.
 */
public class BackendReachabilityCheck implements HealthCheck {

    private final String name;
    private final Backend backend;

    public BackendReachabilityCheck(String name, Backend backend) {
        this.name = name;
        this.backend = backend;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean relevantToPrimary() {
        return backend instanceof PrimaryBackend;
    }

    @Override
    public boolean relevantToSecondary() {
        return !(backend instanceof PrimaryBackend);
    }

    @Override
    public HealthStatus check() {
        if (backend == null) {
            return HealthStatus.critical(name, "No backend configured");
        }
        if (backend.isAvailable()) {
            return HealthStatus.healthy(name, backend.name() + " available");
        }
        return HealthStatus.critical(name, backend.name() + " not found");
    }
}
