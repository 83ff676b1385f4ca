package com.taskweave.core.workflow;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Uniform result of every execution strategy.
 *
 * @param agentsRun       units that started, in start order
 * @param agentsCompleted units that completed
 * @param agentsFailed    units that failed
 * @param agentsSkipped   units never started (condition false or run cancelled)
 * @param results         unit name to output (completed) or error message (failed)
 * @param unitResults     per-unit detail, including skipped and discarded units
 * @param error           first fatal error, null when nothing failed
 * @param cancelled       whether the run was cancelled before it finished
 */
public record WorkflowResult(
    String workflowId,
    ExecutionStrategy strategy,
    WorkflowStatus status,
    List<String> agentsRun,
    List<String> agentsCompleted,
    List<String> agentsFailed,
    List<String> agentsSkipped,
    Map<String, Object> results,
    Map<String, UnitResult> unitResults,
    String error,
    boolean cancelled,
    Duration duration
) {

    public boolean isSuccess() {
        return status == WorkflowStatus.COMPLETED && !cancelled;
    }
}
