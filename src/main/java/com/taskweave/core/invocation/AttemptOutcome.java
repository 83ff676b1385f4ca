package com.taskweave.core.invocation;

import java.util.Map;

/**
 * Result of a single primary attempt. Retry and degrade decisions depend only
 * on the failure kind carried here, never on exception types.
 */
public sealed interface AttemptOutcome {

    record Success(Map<String, Object> result) implements AttemptOutcome {}

    record Failure(FailureKind kind, Throwable cause) implements AttemptOutcome {}

    static AttemptOutcome success(Map<String, Object> result) {
        return new Success(result);
    }

    static AttemptOutcome failure(FailureKind kind, Throwable cause) {
        return new Failure(kind, cause);
    }
}
