package com.taskweave.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setWorkflowPutsWorkflowId() {
        MdcContext.setWorkflow("WF-00C0FFEE");
        assertEquals("WF-00C0FFEE", MDC.get(MdcContext.WORKFLOW_ID));
    }

    @Test
    void setUnitPutsBothKeys() {
        MdcContext.setUnit("WF-00C0FFEE", "DB_unit");
        assertEquals("WF-00C0FFEE", MDC.get(MdcContext.WORKFLOW_ID));
        assertEquals("DB_unit", MDC.get(MdcContext.UNIT_NAME));
    }

    @Test
    void clearUnitKeepsWorkflow() {
        MdcContext.setUnit("WF-00C0FFEE", "DB_unit");
        MdcContext.clearUnit();
        assertEquals("WF-00C0FFEE", MDC.get(MdcContext.WORKFLOW_ID));
        assertNull(MDC.get(MdcContext.UNIT_NAME));
    }

    @Test
    void setAndClearBackend() {
        MdcContext.setBackend("secondary");
        assertEquals("secondary", MDC.get(MdcContext.BACKEND));
        MdcContext.clearBackend();
        assertNull(MDC.get(MdcContext.BACKEND));
    }

    @Test
    void clearRemovesOnlyTaskweaveKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setUnit("WF-00C0FFEE", "API_unit");
        MdcContext.setBackend("primary");

        MdcContext.clear();

        assertNull(MDC.get(MdcContext.WORKFLOW_ID));
        assertNull(MDC.get(MdcContext.UNIT_NAME));
        assertNull(MDC.get(MdcContext.BACKEND));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
