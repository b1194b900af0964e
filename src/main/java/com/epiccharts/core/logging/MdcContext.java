package com.epiccharts.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing bot-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMention(String mentionId) {
        MDC.put("mentionId", mentionId);
    }

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void clear() {
        MDC.remove("mentionId");
        MDC.remove("stage");
    }
}
