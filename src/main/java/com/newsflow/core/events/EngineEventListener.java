package com.newsflow.core.events;

import com.newsflow.core.graph.GraphListener;
import com.newsflow.core.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Bridges scheduler callbacks to the {@link EventBus} and {@link PipelineMetrics}.
 */
@Component
public class EngineEventListener implements GraphListener {

    private static final Logger log = LoggerFactory.getLogger(EngineEventListener.class);

    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public EngineEventListener(EventBus eventBus, PipelineMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @Override
    public void onRunStarted(String runId) {
        eventBus.publish(EngineEvent.of("run.started", runId, null, Map.of()));
    }

    @Override
    public void onSuperstepCompleted(String runId, int superstep, int taskCount, long durationMs) {
        metrics.recordSuperstep(taskCount, durationMs);
        eventBus.publish(EngineEvent.of("superstep.completed", runId, null,
                Map.of("superstep", superstep, "tasks", taskCount, "durationMs", durationMs)));
    }

    @Override
    public void onNodeRetry(String runId, String node, int failedAttempt, Exception error, Duration delay) {
        metrics.recordNodeRetry(node);
        eventBus.publish(EngineEvent.of("node.retry", runId, node,
                Map.of("attempt", failedAttempt, "delayMs", delay.toMillis(), "error", message(error))));
    }

    @Override
    public void onNodeFailed(String runId, String node, Throwable error) {
        metrics.recordNodeFailure(node);
        eventBus.publish(EngineEvent.of("node.failed", runId, node, Map.of("error", message(error))));
    }

    @Override
    public void onInterrupted(String runId, String node, Map<String, Object> payload) {
        metrics.recordInterrupt(node);
        eventBus.publish(EngineEvent.of("run.interrupted", runId, node, payload));
    }

    @Override
    public void onCompleted(String runId, int superstep) {
        eventBus.publish(EngineEvent.of("run.completed", runId, null, Map.of("supersteps", superstep)));
    }

    @Override
    public void onFailed(String runId, String error) {
        log.debug("Run {} reported failure: {}", runId, error);
        eventBus.publish(EngineEvent.of("run.failed", runId, null,
                Map.of("error", error != null ? error : "unknown")));
    }

    private static String message(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
