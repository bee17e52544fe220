package com.newsflow.dispatch.cli;

import com.newsflow.core.persistence.Checkpoint;
import com.newsflow.core.persistence.CheckpointQueryService;
import com.newsflow.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: newsflow status &lt;run-id&gt; [--checkpoints]
 * <p>
 * Reads the latest checkpoint of a run and prints its progress. With
 * {@code --checkpoints} also lists every checkpoint the run has written.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--checkpoints", "-c"}, description = "List all checkpoints of the run")
    private boolean showCheckpoints;

    private final CheckpointQueryService queryService;

    public StatusCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var latestOpt = queryService.getLatestCheckpoint(runId);
        if (latestOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return;
        }

        Checkpoint latest = latestOpt.get();
        PipelineState state = new PipelineState(latest.state());

        System.out.println();
        System.out.println("RUN " + runId);
        System.out.println("Trigger: " + state.triggerType());
        ConsoleOutput.status(latest.status());
        System.out.println("Step: " + state.currentStep() + " (superstep " + latest.superstep() + ")");
        System.out.println("Articles: " + state.deduplicatedArticles().size()
                + " | Summaries: " + state.summaries().size()
                + " | Revisions: " + state.revisionCount());

        if (latest.awaitingResume()) {
            ConsoleOutput.review(latest.interrupt().node(), latest.interrupt().payload());
        }
        if (latest.error() != null) {
            ConsoleOutput.error("Failure: " + latest.error());
        }

        if (showCheckpoints) {
            List<Checkpoint> checkpoints = queryService.listCheckpoints(runId);
            System.out.println();
            System.out.printf("  %-5s %-10s %-10s %-6s %s%n", "SEQ", "SUPERSTEP", "STATUS", "TASKS", "CREATED");
            System.out.println("  " + "-".repeat(64));
            for (Checkpoint cp : checkpoints) {
                System.out.printf("  %-5d %-10d %-10s %-6d %s%n",
                        cp.sequence(), cp.superstep(), cp.status(), cp.frontier().size(), cp.createdAt());
            }
        }

        var errors = state.errorLog();
        if (!errors.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + errors.size() + "):");
            for (var e : errors) {
                ConsoleOutput.error("  " + e);
            }
        }
    }
}
