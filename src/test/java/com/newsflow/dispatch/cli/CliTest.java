package com.newsflow.dispatch.cli;

import com.newsflow.core.engine.PipelineEngine;
import com.newsflow.core.graph.GraphRunException;
import com.newsflow.core.graph.RunBusyException;
import com.newsflow.core.graph.RunResult;
import com.newsflow.core.interrupt.InterruptProtocolException;
import com.newsflow.core.interrupt.ResumeDecision;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.model.TriggerType;
import com.newsflow.core.persistence.Checkpoint;
import com.newsflow.core.persistence.CheckpointQueryService;
import com.newsflow.core.persistence.MemoryCheckpointStore;
import com.newsflow.core.persistence.PendingInterrupt;
import com.newsflow.core.persistence.PendingTask;
import com.newsflow.core.state.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the Newsflow CLI command structure.
 * These tests exercise picocli directly without a Spring context, with the
 * engine mocked and the checkpoint queries backed by an in-memory store.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private PipelineEngine engine;
    private MemoryCheckpointStore store;

    @BeforeEach
    void setUp() {
        engine = mock(PipelineEngine.class);
        store = new MemoryCheckpointStore();
    }

    private static RunResult<PipelineState> awaiting(String runId) {
        var state = new PipelineState(Map.of(
                "runId", runId,
                "currentStep", "images_generated",
                "linkedinDraft", "This week in AI: ..."));
        return new RunResult<>(runId, RunStatus.AWAITING, state,
                new PendingInterrupt(0, "human_approval", Map.of(
                        "linkedin_draft", "This week in AI: ...",
                        "message", "Please review the content and approve or reject with feedback.")),
                7, null);
    }

    private static RunResult<PipelineState> completed(String runId) {
        var state = new PipelineState(Map.of(
                "runId", runId,
                "currentStep", "published",
                "approvalStatus", "APPROVED"));
        return new RunResult<>(runId, RunStatus.COMPLETED, state, null, 9, null);
    }

    private static Checkpoint checkpoint(String runId, long seq, RunStatus status, Map<String, Object> state,
                                         PendingInterrupt interrupt) {
        return new Checkpoint("cp-" + seq, runId, seq, (int) seq, status, state,
                List.of(PendingTask.plain("summarize")), interrupt, List.of(), null,
                Instant.parse("2025-01-06T09:00:00Z"));
    }

    private CommandLine.IFactory createFactory() {
        var queryService = new CheckpointQueryService(store);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine);
                }
                if (cls == ResumeCommand.class) {
                    return (K) new ResumeCommand(engine);
                }
                if (cls == RecoverCommand.class) {
                    return (K) new RecoverCommand(engine);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(queryService);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(queryService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new NewsflowCommand(), createFactory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "resume", "recover", "status", "history", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Durable news digest pipeline"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Newsflow 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void bareCommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("NEWSFLOW v0.1.0"));
            assertTrue(result.output().contains("Usage: newsflow"));
        }

        @Test
        @DisplayName("resume without --action is a usage error")
        void resumeRequiresAction() {
            CliResult result = execute("resume", "NEWS-1");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--action"));
            verifyNoInteractions(engine);
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("a run that stops for review prints the payload and resume hint")
        void awaitingReview() {
            when(engine.trigger(TriggerType.MANUAL)).thenReturn(awaiting("NEWS-1"));

            CliResult result = execute("run");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("RUN NEWS-1"));
            assertTrue(result.output().contains("AWAITING"));
            assertTrue(result.output().contains("[REVIEW human_approval]"));
            assertTrue(result.output().contains("linkedin_draft: This week in AI: ..."));
            assertTrue(result.output().contains("newsflow resume NEWS-1 --action approve|reject"));
        }

        @Test
        @DisplayName("--trigger is case-insensitive")
        void scheduledTrigger() {
            when(engine.trigger(TriggerType.SCHEDULED)).thenReturn(completed("NEWS-2"));

            CliResult result = execute("run", "--trigger", "scheduled");

            assertEquals(0, result.exitCode());
            verify(engine).trigger(TriggerType.SCHEDULED);
        }

        @Test
        @DisplayName("an unknown trigger exits with 2")
        void invalidTrigger() {
            CliResult result = execute("run", "-t", "hourly");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Invalid trigger: hourly"));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("an engine failure exits with 1")
        void engineFailure() {
            when(engine.trigger(any(TriggerType.class))).thenThrow(new GraphRunException("router returned 'x'"));

            CliResult result = execute("run");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Run failed: router returned 'x'"));
        }
    }

    @Nested
    @DisplayName("resume and recover")
    class ResumeTests {

        @Test
        @DisplayName("reject passes the feedback to the engine")
        void rejectWithFeedback() {
            when(engine.resume(eq("NEWS-1"), any())).thenReturn(awaiting("NEWS-1"));

            CliResult result = execute("resume", "NEWS-1", "-a", "reject", "-f", "shorter please");

            assertEquals(0, result.exitCode());
            var decision = ArgumentCaptor.forClass(ResumeDecision.class);
            verify(engine).resume(eq("NEWS-1"), decision.capture());
            assertEquals(ResumeDecision.reject("shorter please"), decision.getValue());
        }

        @Test
        @DisplayName("approve completes the run")
        void approve() {
            when(engine.resume(eq("NEWS-1"), any())).thenReturn(completed("NEWS-1"));

            CliResult result = execute("resume", "NEWS-1", "--action", "APPROVE");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("COMPLETED"));
            assertTrue(result.output().contains("Approval: APPROVED"));
        }

        @Test
        @DisplayName("protocol errors exit with 2")
        void protocolErrors() {
            assertEquals(2, execute("resume", "NEWS-1", "-a", "maybe").exitCode());

            when(engine.resume(eq("NEWS-9"), any()))
                    .thenThrow(new InterruptProtocolException("Run 'NEWS-9' has no outstanding interrupt"));
            CliResult result = execute("resume", "NEWS-9", "-a", "approve");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("no outstanding interrupt"));

            when(engine.resume(eq("NEWS-8"), any())).thenThrow(new RunBusyException("NEWS-8"));
            assertEquals(2, execute("resume", "NEWS-8", "-a", "approve").exitCode());
        }

        @Test
        @DisplayName("recover on a waiting run points at resume")
        void recoverAwaiting() {
            when(engine.recover("NEWS-1"))
                    .thenThrow(new InterruptProtocolException("Run 'NEWS-1' is awaiting a decision; use resume instead"));

            CliResult result = execute("recover", "NEWS-1");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Use: newsflow resume NEWS-1"));
        }

        @Test
        @DisplayName("recover drives the run onward")
        void recover() {
            when(engine.recover("NEWS-1")).thenReturn(completed("NEWS-1"));

            CliResult result = execute("recover", "NEWS-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Step: published (superstep 9)"));
        }
    }

    @Nested
    @DisplayName("status and history")
    class QueryTests {

        @Test
        @DisplayName("status of an unknown run reports it")
        void unknownRun() {
            CliResult result = execute("status", "NEWS-404");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Run not found: NEWS-404"));
        }

        @Test
        @DisplayName("status shows progress, the pending review and the checkpoint table")
        void statusWithCheckpoints() {
            store.save(checkpoint("NEWS-1", 0, RunStatus.RUNNING, Map.of("runId", "NEWS-1"), null));
            store.save(checkpoint("NEWS-1", 1, RunStatus.AWAITING,
                    Map.of("runId", "NEWS-1", "currentStep", "images_generated", "revisionCount", 1,
                            "errorLog", List.of("scrape: timeout")),
                    new PendingInterrupt(0, "human_approval", Map.of("summary_count", 3))));

            CliResult result = execute("status", "NEWS-1", "--checkpoints");

            String output = result.output();
            assertTrue(output.contains("RUN NEWS-1"));
            assertTrue(output.contains("Trigger: MANUAL"));
            assertTrue(output.contains("Step: images_generated (superstep 1)"));
            assertTrue(output.contains("Revisions: 1"));
            assertTrue(output.contains("[REVIEW human_approval]"));
            assertTrue(output.contains("summary_count: 3"));
            assertTrue(output.contains("SUPERSTEP"));
            assertTrue(output.contains("2025-01-06T09:00:00Z"));
            assertTrue(output.contains("scrape: timeout"));
        }

        @Test
        @DisplayName("history with no runs says so")
        void emptyHistory() {
            CliResult result = execute("history");
            assertTrue(result.output().contains("No runs found."));
        }

        @Test
        @DisplayName("history honours --limit and shows the most recent runs")
        void historyLimit() {
            for (String runId : List.of("NEWS-A", "NEWS-B", "NEWS-C")) {
                store.save(checkpoint(runId, 0, RunStatus.COMPLETED,
                        Map.of("runId", runId, "currentStep", "published"), null));
            }

            CliResult result = execute("history", "-n", "2");

            String output = result.output();
            assertTrue(output.contains("Runs (2 of 3)"));
            assertFalse(output.contains("NEWS-A"));
            assertTrue(output.contains("NEWS-B"));
            assertTrue(output.contains("NEWS-C"));
            assertTrue(output.contains("published"));
        }
    }
}
