package com.wavegate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Wavegate.
 * Routes to subcommands: serve, status, history, inspect.
 */
@Command(
        name = "wavegate",
        mixinStandardHelpOptions = true,
        version = "Wavegate 0.1.0",
        description = "Wave task orchestrator with human approval checkpoints",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WavegateCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // reuse the configured CommandLine so subcommands come from the same factory
        spec.commandLine().usage(System.out);
    }
}
