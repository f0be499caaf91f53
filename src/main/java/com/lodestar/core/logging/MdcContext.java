package com.lodestar.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Lodestar-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSelection(String selectionId, String taskType, String strategy) {
        MDC.put("selectionId", selectionId);
        MDC.put("taskType", taskType);
        MDC.put("strategy", strategy);
    }

    public static void clear() {
        MDC.remove("selectionId");
        MDC.remove("taskType");
        MDC.remove("strategy");
    }
}
