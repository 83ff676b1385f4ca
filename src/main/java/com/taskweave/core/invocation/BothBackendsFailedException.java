package com.taskweave.core.invocation;

/**
 * The primary backend failed and the secondary failed as well. This is the only
 * backend-level failure {@link ResilientInvocationController#invoke} propagates.
 */
public class BothBackendsFailedException extends RuntimeException {

    private final String unit;
    private final FailureKind primaryFailure;
    private final InvocationRecord record;

    public BothBackendsFailedException(String unit, FailureKind primaryFailure, Throwable secondaryError,
                                       InvocationRecord record) {
        super("Both backends failed for unit '" + unit + "' (primary: " + primaryFailure
                + ", secondary: " + secondaryError.getMessage() + ")", secondaryError);
        this.unit = unit;
        this.primaryFailure = primaryFailure;
        this.record = record;
    }

    public String unit() {
        return unit;
    }

    public FailureKind kind() {
        return FailureKind.BOTH_FAILED;
    }

    public FailureKind primaryFailure() {
        return primaryFailure;
    }

    public InvocationRecord record() {
        return record;
    }
}
