package com.taskweave.core.unit;

import com.taskweave.core.context.WorkflowContext;

import java.time.Duration;

/**
 * Factory for units whose behaviour is a lambda.
 */
public final class WorkUnits {

    private WorkUnits() {}

    @FunctionalInterface
    public interface Body {
        Object process(WorkflowContext context) throws Exception;
    }

    public static WorkUnit of(String name, Body body) {
        return new LambdaUnit(name, WorkUnit.DEFAULT_MAX_RETRIES, WorkUnit.DEFAULT_BASE_BACKOFF, null, body);
    }

    public static WorkUnit of(String name, int maxRetries, Duration baseBackoff, Body body) {
        return new LambdaUnit(name, maxRetries, baseBackoff, null, body);
    }

    public static WorkUnit of(String name, int maxRetries, Duration baseBackoff, Duration timeout, Body body) {
        return new LambdaUnit(name, maxRetries, baseBackoff, timeout, body);
    }

    private static final class LambdaUnit extends WorkUnit {
        private final Body body;

        LambdaUnit(String name, int maxRetries, Duration baseBackoff, Duration timeout, Body body) {
            super(name, maxRetries, baseBackoff, timeout);
            this.body = body;
        }

        @Override
        protected Object process(WorkflowContext context) throws Exception {
            return body.process(context);
        }
    }
}
