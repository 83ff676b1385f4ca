package com.taskweave.core.context;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of a context's append-only lifecycle log.
 *
 * @param timestamp when the event happened
 * @param unit      the unit it concerns (null for workflow-level events)
 * @param kind      event kind, e.g. "unit.started", "workflow.completed"
 * @param detail    optional free-form detail
 */
public record ContextEvent(
    Instant timestamp,
    String unit,
    String kind,
    String detail
) implements Serializable {}
