package com.newsflow.dispatch.api;

import com.newsflow.core.engine.PipelineEngine;
import com.newsflow.core.graph.RunBusyException;
import com.newsflow.core.graph.RunResult;
import com.newsflow.core.interrupt.InterruptProtocolException;
import com.newsflow.core.interrupt.ResumeDecision;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.model.TriggerType;
import com.newsflow.core.persistence.PendingInterrupt;
import com.newsflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * REST controller for pipeline run lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final PipelineEngine engine;
    private final SseStreamingService sseStreamingService;

    /** Runs accepted by this controller whose async execution has not returned yet. */
    private final Set<String> launching = ConcurrentHashMap.newKeySet();

    static final int MAX_LAUNCH_FAILURES = 256;

    /**
     * Errors of launches that failed before the run wrote a checkpoint, keyed by run ID.
     * Oldest entries are evicted first.
     */
    private final Map<String, String> launchFailures = Collections.synchronizedMap(
            new LinkedHashMap<String, String>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                    return size() > MAX_LAUNCH_FAILURES;
                }
            });

    public RunController(PipelineEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs: Trigger a new pipeline run. Runs asynchronously until it
     * completes or reaches the approval step.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> triggerRun(@RequestBody(required = false) TriggerRequest request) {
        TriggerType triggerType;
        try {
            triggerType = request != null && request.triggerType() != null
                    ? TriggerType.valueOf(request.triggerType().toUpperCase(Locale.ROOT))
                    : TriggerType.MANUAL;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Invalid trigger_type: " + request.triggerType()));
        }

        String runId = engine.generateRunId();
        log.info("Accepted run {} ({}), launching async execution", runId, triggerType);

        launching.add(runId);
        CompletableFuture.runAsync(() -> {
            try {
                engine.trigger(runId, triggerType);
            } catch (Exception e) {
                log.error("Run {} failed", runId, e);
                recordLaunchFailure(runId, e);
            } finally {
                launching.remove(runId);
            }
        });

        return ResponseEntity.accepted().body(Map.of(
                "run_id", runId,
                "status", RunStatus.RUNNING.name()
        ));
    }

    /**
     * GET /api/v1/runs/{runId}: Status of a run from its latest checkpoint.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String runId) {
        Optional<RunResult<PipelineState>> result = engine.status(runId);
        if (result.isPresent()) {
            launchFailures.remove(runId);
            return ResponseEntity.ok(toResponse(result.get()));
        }
        String failure = launchFailures.get(runId);
        if (failure != null) {
            return ResponseEntity.ok(placeholder(runId, RunStatus.FAILED, failure));
        }
        if (launching.contains(runId)) {
            return ResponseEntity.ok(placeholder(runId, RunStatus.CREATED, null));
        }
        return ResponseEntity.notFound().build();
    }

    /**
     * GET /api/v1/runs/{runId}/events: SSE stream of the run's engine events. The
     * stream ends when the run completes or fails.
     */
    @GetMapping(value = "/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String runId) {
        if (engine.status(runId).isEmpty() && !launching.contains(runId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(runId));
    }

    /**
     * POST /api/v1/runs/{runId}/approval: Approve or reject a run waiting for review.
     * Drives the run synchronously to its next stop.
     */
    @PostMapping("/{runId}/approval")
    public ResponseEntity<?> submitApproval(@PathVariable String runId, @RequestBody ApprovalRequest request) {
        ResumeDecision decision;
        try {
            decision = ResumeDecision.parse(request.action(), request.feedback());
        } catch (InterruptProtocolException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        if (engine.status(runId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        try {
            RunResult<PipelineState> result = engine.resume(runId, decision);
            log.info("Approval processed for run {}: {}", runId, decision.action());
            return ResponseEntity.ok(toResponse(result));
        } catch (InterruptProtocolException | RunBusyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /** A failure is only kept while the run has no checkpoint to report instead. */
    void recordLaunchFailure(String runId, Exception e) {
        if (engine.status(runId).isPresent()) {
            return;
        }
        launchFailures.put(runId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    int launchFailureCount() {
        return launchFailures.size();
    }

    private RunResponse toResponse(RunResult<PipelineState> result) {
        PipelineState state = result.state();
        PendingInterrupt interrupt = result.interrupt();
        return new RunResponse(
                result.runId(),
                result.status().name(),
                state.currentStep(),
                state.approvalStatus().name(),
                state.revisionCount(),
                state.deduplicatedArticles().size(),
                state.summaries().size(),
                state.errorLog(),
                interrupt != null ? interrupt.node() : null,
                interrupt != null ? interrupt.payload() : null,
                result.error());
    }

    private RunResponse placeholder(String runId, RunStatus status, String error) {
        return new RunResponse(runId, status.name(), "starting", null, 0, 0, 0, null, null, null, error);
    }
}
