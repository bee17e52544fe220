package com.newsflow.core.graph;

/**
 * Base type of every error raised by the graph engine itself, as opposed to
 * errors thrown by node code.
 */
public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
