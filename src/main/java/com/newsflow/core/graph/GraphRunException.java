package com.newsflow.core.graph;

/**
 * Structural failure discovered while a run was executing, for example a router
 * returning a key its edge does not map. The run is checkpointed as FAILED.
 */
public class GraphRunException extends GraphException {

    public GraphRunException(String message) {
        super(message);
    }

    public GraphRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
