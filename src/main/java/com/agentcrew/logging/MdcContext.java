package com.agentcrew.logging;

import org.slf4j.MDC;

/**
 * Run-scoped MDC keys. Worker threads are pooled, so every {@link #setRun} must be
 * paired with {@link #clear()}.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String CREW_ID = "crewId";

    private MdcContext() {}

    public static void setRun(String taskId, String crewId) {
        MDC.put(TASK_ID, taskId);
        MDC.put(CREW_ID, crewId);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(CREW_ID);
    }
}
