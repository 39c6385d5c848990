package com.lodestar.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Lodestar-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String PHASE = "phase";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setPhase(String runId, String phase) {
        MDC.put(RUN_ID, runId);
        MDC.put(PHASE, phase);
        MDC.remove(STAGE);
    }

    public static void setStage(String runId, String phase, String stage) {
        MDC.put(RUN_ID, runId);
        MDC.put(PHASE, phase);
        MDC.put(STAGE, stage);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(PHASE);
        MDC.remove(STAGE);
    }
}
