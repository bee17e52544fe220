package com.newsflow.core.graph;

import java.util.Map;
import java.util.Objects;

/**
 * Targeted invocation emitted by a {@link FanOutAction}: run {@code node} with
 * {@code arguments} overlaid on the current state.
 */
public record Send(String node, Map<String, Object> arguments) {

    public Send {
        Objects.requireNonNull(node, "node must not be null");
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static Send to(String node) {
        return new Send(node, Map.of());
    }

    public static Send to(String node, Map<String, Object> arguments) {
        return new Send(node, arguments);
    }
}
