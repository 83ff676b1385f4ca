package com.taskweave.core.unit;

/**
 * Thrown by {@link WorkUnit#run} once a unit has exhausted its retries, or hit
 * an error that retrying cannot fix. The unit is {@code FAILED} when this is raised.
 */
public class UnitExecutionFailedException extends RuntimeException {

    private final String unit;
    private final int attempts;

    public UnitExecutionFailedException(String unit, int attempts, Throwable lastError) {
        super("Unit '" + unit + "' failed after " + attempts + " attempt(s): " + describe(lastError), lastError);
        this.unit = unit;
        this.attempts = attempts;
    }

    public String unit() {
        return unit;
    }

    public int attempts() {
        return attempts;
    }

    public Throwable lastError() {
        return getCause();
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
