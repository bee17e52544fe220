package com.newsflow.core.graph;

import com.newsflow.core.state.GraphState;

/**
 * Router of a conditional edge: inspects the state after the source node's superstep
 * and returns a route key.
 */
@FunctionalInterface
public interface EdgeAction<S extends GraphState> {

    String route(S state) throws Exception;
}
