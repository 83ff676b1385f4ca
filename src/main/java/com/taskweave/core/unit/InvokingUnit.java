package com.taskweave.core.unit;

import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.invocation.BothBackendsFailedException;
import com.taskweave.core.invocation.InvocationRecord;
import com.taskweave.core.invocation.InvocationResult;
import com.taskweave.core.invocation.InvocationValidationException;
import com.taskweave.core.invocation.ResilientInvocationController;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * A unit whose work is delegated to a backend through the
 * {@link ResilientInvocationController}. The task text is built from the
 * context when the unit runs, so it can reference earlier units' artifacts.
 * The result is stored under {@code outputKey} when one is given.
 * <p>
 * The controller does its own retrying, so by default this unit does not
 * retry, and it never retries a validation failure or a failure of both backends.
 */
public class InvokingUnit extends WorkUnit {

    private final ResilientInvocationController controller;
    private final Function<WorkflowContext, String> taskBuilder;
    private final String outputKey;

    private volatile InvocationRecord lastRecord;

    public InvokingUnit(String name, ResilientInvocationController controller, String task, String outputKey) {
        this(name, controller, ctx -> task, outputKey, 0, Duration.ZERO, null);
    }

    public InvokingUnit(String name, ResilientInvocationController controller,
                        Function<WorkflowContext, String> taskBuilder, String outputKey,
                        int maxRetries, Duration baseBackoff, Duration timeout) {
        super(name, maxRetries, baseBackoff, timeout);
        this.controller = Objects.requireNonNull(controller, "controller");
        this.taskBuilder = Objects.requireNonNull(taskBuilder, "taskBuilder");
        this.outputKey = outputKey;
    }

    @Override
    protected Object process(WorkflowContext context) {
        String task = taskBuilder.apply(context);
        InvocationResult result = controller.invoke(name(), context, task);
        lastRecord = result.record();
        if (outputKey != null) {
            context.set(outputKey, result.output());
        }
        return result.output();
    }

    @Override
    protected boolean isRetryable(Throwable error) {
        return super.isRetryable(error)
                && !(error instanceof InvocationValidationException)
                && !(error instanceof BothBackendsFailedException);
    }

    /**
     * Record of the most recent invocation, or null if none completed.
     */
    public InvocationRecord lastRecord() {
        return lastRecord;
    }
}
