package com.taskweave.core.health;

import java.util.function.BooleanSupplier;

/**
 * Critical when the primary backend's credentials are missing. Only the primary
 * backend needs credentials, so this check never blocks the secondary.
 */
public class CredentialsCheck implements HealthCheck {

    public static final String NAME = "credentials";

    private final String source;
    private final BooleanSupplier present;

    /**
     * @param source  where credentials come from, for display (e.g. an env var name)
     * @param present whether they are currently available
     */
    public CredentialsCheck(String source, BooleanSupplier present) {
        this.source = source;
        this.present = present;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public HealthStatus check() {
        if (present.getAsBoolean()) {
            return HealthStatus.healthy(NAME, source == null ? "Credentials present" : source + " is set");
        }
        return HealthStatus.critical(NAME, source + " is not set");
    }
}
