package com.newsflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a pipeline run, streamed to SSE clients of the run.
 *
 * @param eventType event type (e.g. "run.started", "superstep.completed", "node.failed")
 * @param runId     the run this event belongs to
 * @param node      the node this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record EngineEvent(
    String eventType,
    String runId,
    String node,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static EngineEvent of(String eventType, String runId, String node, Map<String, Object> payload) {
        return new EngineEvent(eventType, runId, node, payload, Instant.now());
    }
}
