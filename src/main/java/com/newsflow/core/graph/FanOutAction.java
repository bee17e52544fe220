package com.newsflow.core.graph;

import com.newsflow.core.state.GraphState;

import java.util.List;

/**
 * Dynamic fan-out edge: produces one {@link Send} per parallel branch to launch.
 * Returning an empty list launches nothing.
 */
@FunctionalInterface
public interface FanOutAction<S extends GraphState> {

    List<Send> apply(S state) throws Exception;
}
