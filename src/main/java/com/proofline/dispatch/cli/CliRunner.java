package com.proofline.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code proofline} command line once the context is up. Each
 * invocation executes exactly one subcommand; its return value becomes the
 * process exit code through {@link ExitCodeGenerator}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final ProoflineCommand prooflineCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ProoflineCommand prooflineCommand, IFactory factory) {
        this.prooflineCommand = prooflineCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(prooflineCommand, factory).execute(args);
        log.debug("proofline {} finished with exit code {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
