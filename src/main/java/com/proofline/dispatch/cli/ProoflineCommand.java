package com.proofline.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Proofline.
 * Routes to subcommands: sync, ai, status, resync, health.
 */
@Command(
        name = "proofline",
        mixinStandardHelpOptions = true,
        version = "Proofline 0.1.0",
        description = "Incremental source sync and LLM text correction",
        subcommands = {
                SyncCommand.class,
                AiCommand.class,
                StatusCommand.class,
                ResyncCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ProoflineCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
