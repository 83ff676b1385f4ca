package com.taskweave.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while running workflows and invocations.
 *
 * @param eventType  event type, e.g. "workflow.started", "unit.failed", "invocation.degraded"
 * @param workflowId the workflow (context id) this event belongs to; null for events outside a workflow
 * @param unit       the unit this event relates to (nullable for workflow-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record TaskweaveEvent(
    String eventType,
    String workflowId,
    String unit,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static TaskweaveEvent of(String eventType, String workflowId, String unit, Map<String, Object> payload) {
        return new TaskweaveEvent(eventType, workflowId, unit, payload, Instant.now());
    }
}
