package com.newsflow.core.graph;

/**
 * A graph was assembled incorrectly: duplicate or reserved node names, dangling
 * edges, a node without an outgoing edge, or a missing error channel.
 * Raised by the builder and by {@link StateGraph#compile}, never during a run.
 */
public class GraphDefinitionException extends GraphException {

    public GraphDefinitionException(String message) {
        super(message);
    }
}
