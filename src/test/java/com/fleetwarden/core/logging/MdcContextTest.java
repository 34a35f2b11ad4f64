package com.fleetwarden.core.logging;

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
    void clearTaskKeepsSyncCycle() {
        MdcContext.setTask("42", "codex");
        MdcContext.setSyncCycle(3);

        MdcContext.clearTask();

        assertNull(MDC.get(MdcContext.TASK_ID));
        assertNull(MDC.get(MdcContext.AGENT_TYPE));
        assertEquals("3", MDC.get(MdcContext.SYNC_CYCLE));
    }

    @Test
    void nullValuesAreNotStored() {
        MdcContext.setTask(null, null);

        assertNull(MDC.get(MdcContext.TASK_ID));
    }

    @Test
    void clearRemovesEverything() {
        MdcContext.setTask("1");
        MdcContext.setSyncCycle(1);

        MdcContext.clear();

        assertNull(MDC.get(MdcContext.TASK_ID));
        assertNull(MDC.get(MdcContext.SYNC_CYCLE));
    }
}
