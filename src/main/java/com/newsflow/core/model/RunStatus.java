package com.newsflow.core.model;

/**
 * Lifecycle status of a graph run, as recorded in its latest checkpoint.
 */
public enum RunStatus {
    CREATED,
    RUNNING,
    AWAITING,        // Suspended inside a node, waiting for a resume decision
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
