package com.taskweave.core.workflow;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects unit outcomes of one run; safe for concurrent units.
 */
final class RunAggregate {

    private final List<String> order;
    private final List<String> run = new ArrayList<>();
    private final List<String> completed = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final Map<String, UnitResult> unitResults = new LinkedHashMap<>();
    private String firstError;

    RunAggregate(List<WorkflowStep> steps) {
        this.order = steps.stream().map(WorkflowStep::name).toList();
    }

    synchronized void started(String name) {
        run.add(name);
    }

    synchronized void record(UnitResult result) {
        unitResults.put(result.name(), result);
        switch (result.outcome()) {
            case COMPLETED -> completed.add(result.name());
            case FAILED -> {
                failed.add(result.name());
                if (firstError == null) {
                    firstError = "Unit '" + result.name() + "' failed: " + result.error();
                }
            }
            case SKIPPED -> skipped.add(result.name());
            case DISCARDED -> { }
        }
    }

    synchronized int failedCount() {
        return failed.size();
    }

    synchronized WorkflowResult toResult(String workflowId, ExecutionStrategy strategy, boolean cancelled,
                                         Duration duration) {
        var results = new LinkedHashMap<String, Object>();
        var ordered = new LinkedHashMap<String, UnitResult>();
        for (String name : order) {
            UnitResult result = unitResults.get(name);
            if (result == null) {
                continue;
            }
            ordered.put(name, result);
            if (result.outcome() == UnitResult.Outcome.COMPLETED) {
                results.put(name, result.output());
            } else if (result.outcome() == UnitResult.Outcome.FAILED) {
                results.put(name, result.error());
            }
        }
        return new WorkflowResult(
                workflowId,
                strategy,
                WorkflowStatus.of(completed.size(), failed.size(), cancelled),
                List.copyOf(run),
                List.copyOf(completed),
                List.copyOf(failed),
                List.copyOf(skipped),
                Collections.unmodifiableMap(results),
                Collections.unmodifiableMap(ordered),
                firstError,
                cancelled,
                duration);
    }
}
