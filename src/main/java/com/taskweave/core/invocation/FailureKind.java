package com.taskweave.core.invocation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed taxonomy every primary-backend failure is classified into.
 */
public enum FailureKind {
    /** Primary backend not installed, not configured or not reachable. */
    BACKEND_UNAVAILABLE("backend_unavailable"),
    CREDENTIALS_ABSENT("credentials_absent"),
    NETWORK_FAILURE("network_failure"),
    TIMEOUT("timeout"),
    /** Unhandled error inside the primary backend. */
    BACKEND_CRASH("backend_crash"),
    /** Artifacts could not be fully converted for the secondary backend; never fatal. */
    CONTEXT_CONVERSION_FAILURE("context_conversion_failure"),
    RATE_LIMITED("rate_limited"),
    /** Malformed task input; a caller bug. */
    VALIDATION_FAILURE("validation_failure"),
    /** Primary failed and the secondary failed too. The only fatal kind. */
    BOTH_FAILED("both_failed");

    private final String wireName;

    FailureKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static FailureKind fromWireName(String raw) {
        for (FailureKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(raw) || kind.name().equalsIgnoreCase(raw)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown failure kind: " + raw);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
