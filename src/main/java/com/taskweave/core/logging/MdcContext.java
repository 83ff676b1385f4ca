package com.taskweave.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskweave-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String UNIT_NAME = "unitName";
    public static final String BACKEND = "backend";

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put(WORKFLOW_ID, workflowId);
    }

    public static void setUnit(String unitName) {
        MDC.put(UNIT_NAME, unitName);
    }

    public static void setUnit(String workflowId, String unitName) {
        MDC.put(WORKFLOW_ID, workflowId);
        MDC.put(UNIT_NAME, unitName);
    }

    public static void setBackend(String backend) {
        MDC.put(BACKEND, backend);
    }

    public static void clearUnit() {
        MDC.remove(UNIT_NAME);
    }

    public static void clearBackend() {
        MDC.remove(BACKEND);
    }

    public static void clear() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(UNIT_NAME);
        MDC.remove(BACKEND);
    }
}
