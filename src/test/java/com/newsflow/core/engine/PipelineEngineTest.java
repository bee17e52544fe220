package com.newsflow.core.engine;

import com.newsflow.core.graph.CompiledGraph;
import com.newsflow.core.graph.GraphRunException;
import com.newsflow.core.graph.PipelineGraph;
import com.newsflow.core.graph.RunResult;
import com.newsflow.core.interrupt.ResumeDecision;
import com.newsflow.core.metrics.PipelineMetrics;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.model.TriggerType;
import com.newsflow.core.state.PipelineState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PipelineEngineTest {

    private CompiledGraph<PipelineState> graph;
    private SimpleMeterRegistry registry;
    private PipelineEngine engine;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        graph = mock(CompiledGraph.class);
        PipelineGraph pipelineGraph = mock(PipelineGraph.class);
        when(pipelineGraph.getCompiledGraph()).thenReturn(graph);
        registry = new SimpleMeterRegistry();
        engine = new PipelineEngine(pipelineGraph, new PipelineMetrics(registry));
    }

    private static RunResult<PipelineState> result(String runId, RunStatus status, Map<String, Object> state) {
        return new RunResult<>(runId, status, new PipelineState(state), null, 9, null);
    }

    private double runs(String status) {
        var counter = registry.find("newsflow.runs.total").tag("status", status).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("generated run IDs follow NEWS-YYYY-MMDD-xxxxxxxx and are unique")
    void runIdFormat() {
        String first = engine.generateRunId();
        String second = engine.generateRunId();

        assertTrue(first.matches("NEWS-\\d{4}-\\d{4}-[0-9a-f]{8}"), first);
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("trigger seeds the initial state and counts the outcome")
    @SuppressWarnings("unchecked")
    void triggerSeedsState() {
        when(graph.invoke(any(), eq("NEWS-1"))).thenReturn(result("NEWS-1", RunStatus.AWAITING, Map.of()));

        RunResult<PipelineState> result = engine.trigger("NEWS-1", TriggerType.SCHEDULED);

        ArgumentCaptor<Map<String, Object>> input = ArgumentCaptor.forClass(Map.class);
        verify(graph).invoke(input.capture(), eq("NEWS-1"));
        assertEquals("NEWS-1", input.getValue().get("runId"));
        assertEquals("SCHEDULED", input.getValue().get("triggerType"));
        assertEquals(RunStatus.AWAITING, result.status());
        assertEquals(1.0, runs("AWAITING"));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("completed runs record their revision depth")
    void completedRecordsRevisions() {
        when(graph.resume(eq("NEWS-2"), any()))
                .thenReturn(result("NEWS-2", RunStatus.COMPLETED, Map.of("revisionCount", 2)));

        engine.resume("NEWS-2", ResumeDecision.approve());

        assertEquals(1.0, runs("COMPLETED"));
        var revisions = registry.find("newsflow.runs.revisions").summary();
        assertNotNull(revisions);
        assertEquals(1, revisions.count());
        assertEquals(2.0, revisions.totalAmount());
    }

    @Test
    @DisplayName("structural failures are counted as FAILED and rethrown")
    void failureCounted() {
        when(graph.recover("NEWS-3")).thenThrow(new GraphRunException("router returned 'nowhere'"));

        assertThrows(GraphRunException.class, () -> engine.recover("NEWS-3"));
        assertEquals(1.0, runs("FAILED"));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("status and activity are read from the graph")
    void statusDelegates() {
        when(graph.getState("NEWS-4")).thenReturn(Optional.of(result("NEWS-4", RunStatus.RUNNING, Map.of())));
        when(graph.isActive(anyString())).thenReturn(true);

        assertEquals(RunStatus.RUNNING, engine.status("NEWS-4").orElseThrow().status());
        assertTrue(engine.isExecuting("NEWS-4"));
        assertTrue(engine.status("NEWS-5").isEmpty());
    }
}
