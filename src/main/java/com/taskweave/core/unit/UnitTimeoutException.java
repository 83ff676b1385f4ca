package com.taskweave.core.unit;

import java.time.Duration;

/**
 * Raised for a single attempt of a unit that did not finish within its timeout.
 */
public class UnitTimeoutException extends RuntimeException {

    private final Duration timeout;

    public UnitTimeoutException(String unit, Duration timeout) {
        super("Unit '" + unit + "' timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
