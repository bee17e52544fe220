package com.newsflow.dispatch.cli;

import com.newsflow.core.engine.PipelineEngine;
import com.newsflow.core.graph.RunResult;
import com.newsflow.core.interrupt.InterruptProtocolException;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: newsflow recover &lt;run-id&gt;
 * <p>
 * Continues a run from its latest checkpoint after the process that drove it died.
 */
@Command(name = "recover", mixinStandardHelpOptions = true, description = "Continue a run after a crash")
@Component
public class RecoverCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final PipelineEngine engine;

    public RecoverCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunResult<PipelineState> result;
        try {
            result = engine.recover(runId);
        } catch (InterruptProtocolException e) {
            ConsoleOutput.error(e.getMessage());
            ConsoleOutput.info("Use: newsflow resume " + runId + " --action approve|reject");
            return 2;
        } catch (Exception e) {
            ConsoleOutput.error("Recover failed: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.runResult(result);
        return result.status() == RunStatus.FAILED ? 1 : 0;
    }
}
