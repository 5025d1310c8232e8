package com.planview.core.logging;

import org.slf4j.MDC;

import java.nio.file.Path;

/**
 * Utility for managing plan-view MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String PLAN_FILE = "planFile";
    public static final String TASK_ID = "taskId";

    private MdcContext() {}

    public static void setPlanFile(Path planFile) {
        MDC.put(PLAN_FILE, planFile.toString());
    }

    public static void setTask(Path planFile, String taskId) {
        setPlanFile(planFile);
        MDC.put(TASK_ID, taskId);
    }

    public static void clear() {
        MDC.remove(PLAN_FILE);
        MDC.remove(TASK_ID);
    }
}
