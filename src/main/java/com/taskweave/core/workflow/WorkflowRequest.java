package com.taskweave.core.workflow;

import com.taskweave.core.context.Priority;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to create the context of a new workflow run.
 *
 * @param ttl              null for the configured default
 * @param initialArtifacts artifacts present before the first unit runs
 */
public record WorkflowRequest(
    String task,
    String owner,
    Priority priority,
    Duration ttl,
    Map<String, Object> initialArtifacts
) {

    public WorkflowRequest {
        priority = priority != null ? priority : Priority.NORMAL;
        initialArtifacts = initialArtifacts == null ? Map.of() : new LinkedHashMap<>(initialArtifacts);
    }

    public static WorkflowRequest of(String task) {
        return new WorkflowRequest(task, null, Priority.NORMAL, null, Map.of());
    }

    public static WorkflowRequest of(String task, Map<String, Object> initialArtifacts) {
        return new WorkflowRequest(task, null, Priority.NORMAL, null, initialArtifacts);
    }
}
