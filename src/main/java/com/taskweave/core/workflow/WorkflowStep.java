package com.taskweave.core.workflow;

import com.taskweave.core.context.WorkflowContext;
import com.taskweave.core.unit.WorkUnit;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One entry of a workflow: a named unit plus, for conditional workflows, the
 * predicate deciding whether it runs. The predicate is evaluated when the step
 * is reached, so it sees everything earlier steps wrote.
 *
 * @param condition null means "always run"
 */
public record WorkflowStep(String name, WorkUnit unit, Predicate<WorkflowContext> condition) {

    public WorkflowStep {
        Objects.requireNonNull(unit, "unit");
        if (name == null || name.isBlank()) {
            name = unit.name();
        } else if (!name.equals(unit.name())) {
            throw new IllegalArgumentException("Step name '" + name + "' does not match unit name '" + unit.name() + "'");
        }
    }

    public static WorkflowStep of(WorkUnit unit) {
        return new WorkflowStep(unit.name(), unit, null);
    }

    public static WorkflowStep of(String name, WorkUnit unit) {
        return new WorkflowStep(name, unit, null);
    }

    public static WorkflowStep when(WorkUnit unit, Predicate<WorkflowContext> condition) {
        return new WorkflowStep(unit.name(), unit, Objects.requireNonNull(condition, "condition"));
    }

    public boolean isConditional() {
        return condition != null;
    }
}
