package com.proofline.core.logging;

import com.proofline.core.model.Task;
import org.slf4j.MDC;

/**
 * Utility for managing Proofline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRunner(String runner) {
        MDC.put("runner", runner);
    }

    public static void setTask(Task task) {
        MDC.put("taskId", String.valueOf(task.id()));
        MDC.put("stage", task.stage().dbValue());
    }

    public static void clear() {
        MDC.remove("runner");
        MDC.remove("taskId");
        MDC.remove("stage");
    }
}
