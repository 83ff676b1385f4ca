package com.taskweave.core.workflow;

import java.time.Duration;

/**
 * What happened to one step of a workflow run.
 *
 * @param output result of the unit when it completed, null otherwise
 * @param error  failure message when it failed, or why it was skipped
 */
public record UnitResult(String name, Outcome outcome, Object output, String error, Duration duration) {

    public enum Outcome {
        COMPLETED,
        FAILED,
        SKIPPED,
        /** Finished after the workflow was cancelled; excluded from the aggregate. */
        DISCARDED
    }

    static UnitResult completed(String name, Object output, Duration duration) {
        return new UnitResult(name, Outcome.COMPLETED, output, null, duration);
    }

    static UnitResult failed(String name, String error, Duration duration) {
        return new UnitResult(name, Outcome.FAILED, null, error, duration);
    }

    static UnitResult skipped(String name, String reason) {
        return new UnitResult(name, Outcome.SKIPPED, null, reason, Duration.ZERO);
    }

    static UnitResult discarded(String name, Duration duration) {
        return new UnitResult(name, Outcome.DISCARDED, null, null, duration);
    }
}
