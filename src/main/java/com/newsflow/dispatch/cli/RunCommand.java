package com.newsflow.dispatch.cli;

import com.newsflow.core.engine.PipelineEngine;
import com.newsflow.core.graph.RunResult;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.model.TriggerType;
import com.newsflow.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: newsflow run [--trigger manual|scheduled]
 * <p>
 * Starts a pipeline run and drives it until it completes or stops at the approval step.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Start a pipeline run")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--trigger", "-t"},
            description = "Trigger type: MANUAL, SCHEDULED (default: ${DEFAULT-VALUE})",
            defaultValue = "MANUAL")
    private String trigger;

    private final PipelineEngine engine;

    public RunCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        TriggerType triggerType;
        try {
            triggerType = TriggerType.valueOf(trigger.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid trigger: " + trigger + ". Valid triggers: MANUAL, SCHEDULED");
            return 2;
        }

        ConsoleOutput.info("Starting " + triggerType.name().toLowerCase(Locale.ROOT) + " run...");
        RunResult<PipelineState> result;
        try {
            result = engine.trigger(triggerType);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.runResult(result);
        return result.status() == RunStatus.FAILED ? 1 : 0;
    }
}
