package com.newsflow.core.graph;

import com.newsflow.core.retry.RetryPolicy;
import com.newsflow.core.state.Channel;
import com.newsflow.core.state.GraphState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Builder for a graph of named nodes connected by static, conditional and
 * dynamic fan-out edges.
 * <p>
 * Structure is fixed once {@link #compile} returns; the same compiled graph can
 * drive any number of runs.
 *
 * @param <S> the state type handed to nodes and routers
 */
public class StateGraph<S extends GraphState> {

    public static final String START = "__start__";
    public static final String END = "__end__";

    private final Map<String, Channel> schema;
    private final Function<Map<String, Object>, S> stateFactory;
    private final NodeRegistry<S> registry = new NodeRegistry<>();
    private final Map<String, List<Edge<S>>> edges = new LinkedHashMap<>();

    public StateGraph(Map<String, Channel> schema, Function<Map<String, Object>, S> stateFactory) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory must not be null");
    }

    public StateGraph<S> addNode(String name, NodeAction<S> action) {
        return addNode(name, action, RetryPolicy.NONE);
    }

    public StateGraph<S> addNode(String name, NodeAction<S> action, RetryPolicy retryPolicy) {
        registry.register(name, action, retryPolicy);
        return this;
    }

    public StateGraph<S> addEdge(String from, String to) {
        checkSource(from);
        checkTarget(from, to);
        return addOutgoing(from, new Edge.Static<>(to));
    }

    /**
     * Adds a decision point after {@code from}: the router's return value is looked
     * up in {@code routes} to pick the single successor.
     */
    public StateGraph<S> addConditionalEdges(String from, EdgeAction<S> router, Map<String, String> routes) {
        checkSource(from);
        Objects.requireNonNull(router, "router must not be null");
        if (routes == null || routes.isEmpty()) {
            throw new GraphDefinitionException("Conditional edge from '" + from + "' has no routes");
        }
        routes.values().forEach(target -> checkTarget(from, target));
        return addOutgoing(from, new Edge.Conditional<>(router, routes));
    }

    /**
     * Adds a dynamic fan-out after {@code from}: every {@link Send} returned by
     * {@code fn} becomes one concurrent branch of the next superstep.
     */
    public StateGraph<S> addFanOut(String from, FanOutAction<S> fn) {
        checkSource(from);
        Objects.requireNonNull(fn, "fan-out function must not be null");
        return addOutgoing(from, new Edge.FanOut<>(fn));
    }

    public CompiledGraph<S> compile() {
        return compile(CompileConfig.defaults());
    }

    /**
     * Validates the structure and binds it to the runtime settings.
     *
     * @throws GraphDefinitionException if the graph is malformed
     */
    public CompiledGraph<S> compile(CompileConfig config) {
        Channel errorChannel = schema.get(config.errorField());
        if (errorChannel == null || !errorChannel.appends()) {
            throw new GraphDefinitionException("Error field '" + config.errorField()
                    + "' must be declared in the schema with append discipline");
        }
        if (!edges.containsKey(START)) {
            throw new GraphDefinitionException("Graph has no edge from START");
        }

        for (var entry : edges.entrySet()) {
            String source = entry.getKey();
            if (!START.equals(source) && !registry.contains(source)) {
                throw new GraphDefinitionException("Edge source '" + source + "' is not a registered node");
            }
            for (Edge<S> edge : entry.getValue()) {
                for (String target : staticTargets(edge)) {
                    if (!END.equals(target) && !registry.contains(target)) {
                        throw new GraphDefinitionException("Edge from '" + source
                                + "' targets unknown node '" + target + "'");
                    }
                }
            }
        }

        for (String node : registry.names()) {
            if (!edges.containsKey(node)) {
                throw new GraphDefinitionException("Node '" + node + "' has no outgoing edge");
            }
        }

        return new CompiledGraph<>(schema, stateFactory, registry.snapshot(), copyEdges(),
                staticReachability(), config);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private StateGraph<S> addOutgoing(String from, Edge<S> edge) {
        edges.computeIfAbsent(from, k -> new ArrayList<>()).add(edge);
        return this;
    }

    private void checkSource(String from) {
        if (from == null || from.isBlank()) {
            throw new GraphDefinitionException("Edge source must not be blank");
        }
        if (END.equals(from)) {
            throw new GraphDefinitionException("END cannot have outgoing edges");
        }
    }

    private void checkTarget(String from, String to) {
        if (to == null || to.isBlank()) {
            throw new GraphDefinitionException("Edge from '" + from + "' has a blank target");
        }
        if (START.equals(to)) {
            throw new GraphDefinitionException("Edge from '" + from + "' cannot target START");
        }
    }

    private List<String> staticTargets(Edge<S> edge) {
        if (edge instanceof Edge.Static<S> s) {
            return List.of(s.target());
        }
        if (edge instanceof Edge.Conditional<S> c) {
            return List.copyOf(c.routes().values());
        }
        return List.of();
    }

    private Map<String, List<Edge<S>>> copyEdges() {
        var copy = new LinkedHashMap<String, List<Edge<S>>>();
        edges.forEach((source, list) -> copy.put(source, List.copyOf(list)));
        return copy;
    }

    /**
     * For every node, the nodes reachable from it through static edges alone.
     * Used by the scheduler to hold back a join node until all of its static
     * predecessors in the frontier have run.
     */
    private Map<String, Set<String>> staticReachability() {
        var reach = new LinkedHashMap<String, Set<String>>();
        for (String node : registry.names()) {
            Set<String> seen = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>(directStaticTargets(node));
            while (!queue.isEmpty()) {
                String next = queue.poll();
                if (END.equals(next) || !seen.add(next)) continue;
                queue.addAll(directStaticTargets(next));
            }
            reach.put(node, Set.copyOf(seen));
        }
        return reach;
    }

    private List<String> directStaticTargets(String node) {
        List<String> targets = new ArrayList<>();
        for (Edge<S> edge : edges.getOrDefault(node, List.of())) {
            if (edge instanceof Edge.Static<S> s) {
                targets.add(s.target());
            }
        }
        return targets;
    }
}
