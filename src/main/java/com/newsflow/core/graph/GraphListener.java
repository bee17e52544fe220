package com.newsflow.core.graph;

import java.time.Duration;
import java.util.Map;

/**
 * Observer of run lifecycle notifications. All methods default to no-ops.
 * <p>
 * Called synchronously from the thread driving the run, except
 * {@link #onNodeRetry} and {@link #onNodeFailed}, which may arrive from fan-out
 * worker threads.
 */
public interface GraphListener {

    GraphListener NONE = new GraphListener() {};

    default void onRunStarted(String runId) {}

    default void onSuperstepCompleted(String runId, int superstep, int taskCount, long durationMs) {}

    default void onNodeRetry(String runId, String node, int failedAttempt, Exception error, Duration delay) {}

    default void onNodeFailed(String runId, String node, Throwable error) {}

    default void onInterrupted(String runId, String node, Map<String, Object> payload) {}

    default void onCompleted(String runId, int superstep) {}

    default void onFailed(String runId, String error) {}
}
