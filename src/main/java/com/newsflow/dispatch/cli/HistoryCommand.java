package com.newsflow.dispatch.cli;

import com.newsflow.core.persistence.CheckpointQueryService;
import com.newsflow.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: newsflow history
 * <p>
 * Lists the runs in the checkpoint store as a table:
 * Run ID | Status | Step | Summaries.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List pipeline runs")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final CheckpointQueryService queryService;

    public HistoryCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> runIds = queryService.listRunIds();
        if (runIds.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        List<String> display = runIds.size() > limit
                ? runIds.subList(runIds.size() - limit, runIds.size())
                : runIds;

        ConsoleOutput.info("Runs (" + display.size() + " of " + runIds.size() + "):");
        System.out.println();
        System.out.printf("  %-26s %-10s %-20s %s%n", "RUN ID", "STATUS", "STEP", "SUMMARIES");
        System.out.println("  " + "-".repeat(70));

        for (String runId : display) {
            var cpOpt = queryService.getLatestCheckpoint(runId);
            if (cpOpt.isPresent()) {
                var cp = cpOpt.get();
                var state = new PipelineState(cp.state());
                System.out.printf("  %-26s %-10s %-20s %d%n",
                        runId, cp.status(), state.currentStep(), state.summaries().size());
            } else {
                System.out.printf("  %-26s %-10s %-20s %s%n", runId, "UNKNOWN", "-", "-");
            }
        }
    }
}
