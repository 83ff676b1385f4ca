package com.taskweave.core.context;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the full logical state of a {@link WorkflowContext}.
 * <p>
 * This is the persisted form: two contexts are logically equal when their
 * snapshots are equal.
 */
public record ContextSnapshot(
    String id,
    ContextMetadata metadata,
    boolean archived,
    String task,
    String phase,
    String currentUnit,
    List<String> completedUnits,
    Map<String, Object> artifacts,
    Map<String, UnitDescriptor> unitStates,
    List<ContextEvent> eventLog,
    List<DegradationRecord> degradationLog
) implements Serializable {}
