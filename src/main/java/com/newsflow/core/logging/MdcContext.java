package com.newsflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Newsflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String NODE = "node";
    public static final String SUPERSTEP = "superstep";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setSuperstep(String runId, int superstep) {
        MDC.put(RUN_ID, runId);
        MDC.put(SUPERSTEP, String.valueOf(superstep));
    }

    public static void setNode(String runId, int superstep, String node) {
        MDC.put(RUN_ID, runId);
        MDC.put(SUPERSTEP, String.valueOf(superstep));
        MDC.put(NODE, node);
    }

    public static void clearNode() {
        MDC.remove(NODE);
    }

    public static void clearSuperstep() {
        MDC.remove(SUPERSTEP);
        MDC.remove(NODE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(NODE);
        MDC.remove(SUPERSTEP);
    }
}
