package com.newsflow.core.graph;

import com.newsflow.core.state.GraphState;

import java.util.Map;

/**
 * Outgoing transition of a node (or of START).
 */
public interface Edge<S extends GraphState> {

    /** Always schedules {@code target}. */
    record Static<S extends GraphState>(String target) implements Edge<S> {}

    /** Schedules {@code routes.get(router.route(state))}; END schedules nothing. */
    record Conditional<S extends GraphState>(EdgeAction<S> router, Map<String, String> routes) implements Edge<S> {

        public Conditional {
            routes = Map.copyOf(routes);
        }
    }

    /** Schedules one fan-out task per {@link Send}. */
    record FanOut<S extends GraphState>(FanOutAction<S> fn) implements Edge<S> {}
}
