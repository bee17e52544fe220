package com.newsflow.dispatch.cli;

import com.newsflow.core.engine.PipelineEngine;
import com.newsflow.core.graph.RunBusyException;
import com.newsflow.core.graph.RunResult;
import com.newsflow.core.interrupt.InterruptProtocolException;
import com.newsflow.core.interrupt.ResumeDecision;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: newsflow resume &lt;run-id&gt; --action approve|reject [--feedback text]
 * <p>
 * Delivers a reviewer decision to a run waiting at the approval step.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Approve or reject a waiting run")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--action", "-a"}, required = true, description = "approve or reject")
    private String action;

    @Option(names = {"--feedback", "-f"}, description = "Revision notes for a rejection", defaultValue = "")
    private String feedback;

    private final PipelineEngine engine;

    public ResumeCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunResult<PipelineState> result;
        try {
            ResumeDecision decision = ResumeDecision.parse(action, feedback);
            ConsoleOutput.info("Resuming " + runId + " with " + decision.action() + "...");
            result = engine.resume(runId, decision);
        } catch (InterruptProtocolException | RunBusyException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (Exception e) {
            ConsoleOutput.error("Resume failed: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.runResult(result);
        return result.status() == RunStatus.FAILED ? 1 : 0;
    }
}
