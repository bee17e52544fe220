package com.newsflow.core.graph;

import com.newsflow.core.retry.RetryPolicy;
import com.newsflow.core.state.GraphState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named set of nodes, in registration order.
 */
public class NodeRegistry<S extends GraphState> {

    private final Map<String, NodeSpec<S>> nodes = new LinkedHashMap<>();

    /**
     * @throws GraphDefinitionException if the name is blank, reserved, or already registered
     */
    public void register(String name, NodeAction<S> action, RetryPolicy retryPolicy) {
        if (name == null || name.isBlank()) {
            throw new GraphDefinitionException("Node name must not be blank");
        }
        if (StateGraph.START.equals(name) || StateGraph.END.equals(name)) {
            throw new GraphDefinitionException("Node name '" + name + "' is reserved");
        }
        if (nodes.containsKey(name)) {
            throw new GraphDefinitionException("Node '" + name + "' is already registered");
        }
        nodes.put(name, new NodeSpec<>(name, action, retryPolicy));
    }

    public Optional<NodeSpec<S>> lookup(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    Map<String, NodeSpec<S>> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }
}
