package com.taskweave.core.backend;

import com.taskweave.core.context.ContextSnapshot;

import java.util.Map;

/**
 * Structured, capability-rich backend that is always attempted first.
 */
@FunctionalInterface
public non-sealed interface PrimaryBackend extends Backend {

    /**
     * @return the structured result of the task
     * @throws BackendException for failures the backend can classify itself
     */
    Map<String, Object> call(String task, ContextSnapshot context, ToolPermissions permissions) throws Exception;

    @Override
    default String name() {
        return "primary";
    }
}
