package com.newsflow.core.engine;

import com.newsflow.core.graph.CompiledGraph;
import com.newsflow.core.graph.GraphRunException;
import com.newsflow.core.graph.PipelineGraph;
import com.newsflow.core.graph.RunResult;
import com.newsflow.core.interrupt.ResumeDecision;
import com.newsflow.core.logging.MdcContext;
import com.newsflow.core.metrics.PipelineMetrics;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.model.TriggerType;
import com.newsflow.core.persistence.CheckpointStoreException;
import com.newsflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.UUID;

/**
 * Entry point for callers that start, resume or inspect pipeline runs.
 * <p>
 * Generates run IDs, builds the initial state, and records the outcome of every
 * call in the run metrics.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final DateTimeFormatter RUN_DATE = DateTimeFormatter.ofPattern("yyyy-MMdd");

    private final CompiledGraph<PipelineState> graph;
    private final PipelineMetrics metrics;

    public PipelineEngine(PipelineGraph pipelineGraph, PipelineMetrics metrics) {
        this.graph = pipelineGraph.getCompiledGraph();
        this.metrics = metrics;
    }

    /**
     * Starts a run with a freshly generated ID and drives it to completion or suspension.
     */
    public RunResult<PipelineState> trigger(TriggerType triggerType) {
        return trigger(generateRunId(), triggerType);
    }

    /**
     * Starts a run with a pre-generated ID (e.g. from the REST controller).
     */
    public RunResult<PipelineState> trigger(String runId, TriggerType triggerType) {
        MdcContext.setRun(runId);
        try {
            log.info("Triggering run {} ({})", runId, triggerType);
            Map<String, Object> input = Map.of(
                    "runId", runId,
                    "triggerType", triggerType.name(),
                    "currentStep", "starting");
            return record(() -> graph.invoke(input, runId));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Resumes a run that is waiting at the approval step.
     */
    public RunResult<PipelineState> resume(String runId, ResumeDecision decision) {
        MdcContext.setRun(runId);
        try {
            log.info("Resuming run {} with {}", runId, decision.action());
            return record(() -> graph.resume(runId, decision));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues a run that was interrupted by a process restart.
     */
    public RunResult<PipelineState> recover(String runId) {
        MdcContext.setRun(runId);
        try {
            return record(() -> graph.recover(runId));
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<RunResult<PipelineState>> status(String runId) {
        return graph.getState(runId);
    }

    public boolean isExecuting(String runId) {
        return graph.isActive(runId);
    }

    /**
     * Generates a unique run ID in the format NEWS-YYYY-MMDD-xxxxxxxx.
     */
    public String generateRunId() {
        String date = LocalDate.now(ZoneOffset.UTC).format(RUN_DATE);
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "NEWS-" + date + "-" + suffix;
    }

    private RunResult<PipelineState> record(Supplier<RunResult<PipelineState>> call) {
        RunResult<PipelineState> result;
        try {
            result = call.get();
        } catch (GraphRunException | CheckpointStoreException e) {
            metrics.recordRunResult(RunStatus.FAILED.name());
            throw e;
        }
        metrics.recordRunResult(result.status().name());
        if (result.status() == RunStatus.COMPLETED) {
            metrics.recordRevisionDepth(result.state().revisionCount());
        }
        log.info("Run {} is {} after {} supersteps", result.runId(), result.status(), result.superstep());
        return result;
    }
}
