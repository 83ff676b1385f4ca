package com.taskweave.core.invocation;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static decision table: what the controller does after a primary failure of a given kind.
 */
public final class DegradationPolicy {

    public enum Action {
        /** Retrying cannot help; go straight to the secondary backend. */
        IMMEDIATE_DEGRADE,
        /** Retry with exponential backoff up to the limit, then degrade. */
        RETRY_THEN_DEGRADE,
        /** Caller error; raise without retry or degrade. */
        SURFACE
    }

    private static final Map<FailureKind, Action> TABLE = new EnumMap<>(FailureKind.class);

    static {
        TABLE.put(FailureKind.BACKEND_UNAVAILABLE, Action.IMMEDIATE_DEGRADE);
        TABLE.put(FailureKind.CREDENTIALS_ABSENT, Action.IMMEDIATE_DEGRADE);
        TABLE.put(FailureKind.CONTEXT_CONVERSION_FAILURE, Action.IMMEDIATE_DEGRADE);
        TABLE.put(FailureKind.TIMEOUT, Action.RETRY_THEN_DEGRADE);
        TABLE.put(FailureKind.NETWORK_FAILURE, Action.RETRY_THEN_DEGRADE);
        TABLE.put(FailureKind.BACKEND_CRASH, Action.RETRY_THEN_DEGRADE);
        TABLE.put(FailureKind.RATE_LIMITED, Action.RETRY_THEN_DEGRADE);
        TABLE.put(FailureKind.VALIDATION_FAILURE, Action.SURFACE);
        TABLE.put(FailureKind.BOTH_FAILED, Action.SURFACE);
    }

    private DegradationPolicy() {}

    public static Action actionFor(FailureKind kind) {
        return TABLE.get(kind);
    }

    public static boolean isRetryable(FailureKind kind) {
        return actionFor(kind) == Action.RETRY_THEN_DEGRADE;
    }
}
