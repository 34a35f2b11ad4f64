package com.fleetwarden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Fleetwarden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String AGENT_TYPE = "agentType";
    public static final String SYNC_CYCLE = "syncCycle";

    private MdcContext() {}

    public static void setTask(String taskId) {
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
    }

    public static void setTask(String taskId, String agentType) {
        setTask(taskId);
        if (agentType != null) {
            MDC.put(AGENT_TYPE, agentType);
        }
    }

    public static void setSyncCycle(long cycle) {
        MDC.put(SYNC_CYCLE, String.valueOf(cycle));
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_TYPE);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_TYPE);
        MDC.remove(SYNC_CYCLE);
    }
}
