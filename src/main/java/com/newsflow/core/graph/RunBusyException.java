package com.newsflow.core.graph;

/**
 * Another caller is already driving the run.
 */
public class RunBusyException extends GraphException {

    private final String runId;

    public RunBusyException(String runId) {
        super("Run '" + runId + "' is already executing");
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
