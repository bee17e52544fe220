package com.newsflow.dispatch.cli;

import com.newsflow.core.graph.RunResult;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.state.PipelineState;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for Newsflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) NEWSFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [NEWSFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(RunStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case AWAITING -> "fg(yellow)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|bold," + color + " " + status + "|@"));
    }

    /**
     * Prints the outcome of a run call: status, progress counters, review payload and errors.
     */
    public static void runResult(RunResult<PipelineState> result) {
        PipelineState state = result.state();
        System.out.println();
        System.out.println("RUN " + result.runId());
        status(result.status());
        System.out.println("Step: " + state.currentStep() + " (superstep " + result.superstep() + ")");
        System.out.println("Articles: " + state.deduplicatedArticles().size()
                + " | Summaries: " + state.summaries().size()
                + " | Images: " + state.imagePaths().size()
                + " | Revisions: " + state.revisionCount());
        System.out.println("Approval: " + state.approvalStatus());

        if (result.isInterrupted()) {
            review(result.interrupt().node(), result.interrupt().payload());
            info("Resume with: newsflow resume " + result.runId() + " --action approve|reject");
        }
        if (result.error() != null) {
            error("Failure: " + result.error());
        }

        var errors = state.errorLog();
        if (!errors.isEmpty()) {
            System.out.println();
            error("Errors (" + errors.size() + "):");
            for (String e : errors) {
                error("  " + e);
            }
        }
    }

    public static void review(String node, Map<String, Object> payload) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [REVIEW " + node + "]|@ " + payload.getOrDefault("message", "")));
        payload.forEach((key, value) -> {
            if (!"message".equals(key)) {
                System.out.println("  " + key + ": " + truncate(String.valueOf(value), 120));
            }
        });
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
