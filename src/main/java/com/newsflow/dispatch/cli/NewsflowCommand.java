package com.newsflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Newsflow.
 * Routes to subcommands: run, resume, recover, status, history, serve.
 */
@Command(
        name = "newsflow",
        mixinStandardHelpOptions = true,
        version = "Newsflow 0.1.0",
        description = "Durable news digest pipeline with human approval",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                RecoverCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class NewsflowCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
