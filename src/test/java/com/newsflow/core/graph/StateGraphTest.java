package com.newsflow.core.graph;

import com.newsflow.core.retry.RetryPolicy;
import com.newsflow.core.state.Channel;
import com.newsflow.core.state.Channels;
import com.newsflow.core.state.GraphState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.newsflow.core.graph.StateGraph.END;
import static com.newsflow.core.graph.StateGraph.START;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural validation performed while building and compiling a graph.
 */
class StateGraphTest {

    private static final Map<String, Channel> SCHEMA = Map.of(
            "errorLog", Channels.append(),
            "status", Channels.overwrite()
    );

    private static final NodeAction<GraphState> NOOP = state -> Map.of();

    private StateGraph<GraphState> graph() {
        return new StateGraph<GraphState>(SCHEMA, GraphState::new);
    }

    @Test
    @DisplayName("well-formed graph compiles")
    void compiles() {
        assertNotNull(graph()
                .addNode("a", NOOP)
                .addEdge(START, "a")
                .addEdge("a", END)
                .compile());
    }

    @Test
    @DisplayName("duplicate node names are rejected")
    void duplicateNode() {
        var graph = graph().addNode("a", NOOP);
        assertThrows(GraphDefinitionException.class, () -> graph.addNode("a", NOOP));
    }

    @Test
    @DisplayName("reserved and blank node names are rejected")
    void reservedNames() {
        assertThrows(GraphDefinitionException.class, () -> graph().addNode(START, NOOP));
        assertThrows(GraphDefinitionException.class, () -> graph().addNode(END, NOOP));
        assertThrows(GraphDefinitionException.class, () -> graph().addNode(" ", NOOP));
    }

    @Test
    @DisplayName("graph without an edge from START is rejected")
    void missingStart() {
        var graph = graph().addNode("a", NOOP).addEdge("a", END);
        assertThrows(GraphDefinitionException.class, graph::compile);
    }

    @Test
    @DisplayName("edge to an unknown node is rejected at compile time")
    void unknownTarget() {
        var graph = graph()
                .addNode("a", NOOP)
                .addEdge(START, "a")
                .addEdge("a", "b");
        GraphDefinitionException error = assertThrows(GraphDefinitionException.class, graph::compile);
        assertTrue(error.getMessage().contains("'b'"));
    }

    @Test
    @DisplayName("conditional route to an unknown node is rejected at compile time")
    void unknownRouteTarget() {
        var graph = graph()
                .addNode("a", NOOP)
                .addEdge(START, "a")
                .addConditionalEdges("a", state -> "x", Map.of("x", "missing"));
        assertThrows(GraphDefinitionException.class, graph::compile);
    }

    @Test
    @DisplayName("edge from an unknown node is rejected at compile time")
    void unknownSource() {
        var graph = graph()
                .addNode("a", NOOP)
                .addEdge(START, "a")
                .addEdge("a", END)
                .addEdge("ghost", "a");
        assertThrows(GraphDefinitionException.class, graph::compile);
    }

    @Test
    @DisplayName("node without an outgoing edge is rejected")
    void danglingNode() {
        var graph = graph()
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addEdge(START, "a")
                .addEdge("a", END);
        assertThrows(GraphDefinitionException.class, graph::compile);
    }

    @Test
    @DisplayName("edges into START, out of END, or with empty routes are rejected")
    void invalidEdges() {
        assertThrows(GraphDefinitionException.class, () -> graph().addEdge("a", START));
        assertThrows(GraphDefinitionException.class, () -> graph().addEdge(END, "a"));
        assertThrows(GraphDefinitionException.class, () -> graph().addConditionalEdges("a", state -> "x", Map.of()));
    }

    @Test
    @DisplayName("error field must be an append channel of the schema")
    void errorFieldMustAppend() {
        var graph = graph().addNode("a", NOOP).addEdge(START, "a").addEdge("a", END);

        assertThrows(GraphDefinitionException.class,
                () -> graph.compile(CompileConfig.builder().errorField("status").build()));
        assertThrows(GraphDefinitionException.class,
                () -> graph.compile(CompileConfig.builder().errorField("missing").build()));
    }

    @Test
    @DisplayName("maxParallel below one is rejected")
    void maxParallelBounds() {
        assertThrows(IllegalArgumentException.class, () -> CompileConfig.builder().maxParallel(0));
    }

    @Test
    @DisplayName("registry looks nodes up by name in registration order")
    void registryLookup() {
        var registry = new NodeRegistry<GraphState>();
        registry.register("first", NOOP, RetryPolicy.NONE);
        registry.register("second", NOOP, null);

        assertTrue(registry.contains("first"));
        assertTrue(registry.lookup("missing").isEmpty());
        assertEquals(List.of("first", "second"), List.copyOf(registry.names()));
        assertEquals(RetryPolicy.NONE, registry.lookup("second").orElseThrow().retryPolicy());
    }
}
