package com.newsflow.core.graph;

import com.newsflow.core.state.GraphState;

import java.util.Map;

/**
 * Unit of work executed by the scheduler. Receives a read-only state snapshot and
 * returns a partial update; returning {@code null} or an empty map changes nothing.
 */
@FunctionalInterface
public interface NodeAction<S extends GraphState> {

    Map<String, Object> apply(S state) throws Exception;
}
