package com.proofline.dispatch.cli;

import com.proofline.core.engine.CorrectionRunner;
import com.proofline.core.engine.RunResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: proofline ai
 * <p>
 * Runs one correction cycle for the oldest task in the {@code ai} stage.
 */
@Command(name = "ai", mixinStandardHelpOptions = true,
        description = "Send one batch of pending items to the task's model and store the corrections")
@Component
public class AiCommand implements Callable<Integer> {

    private final CorrectionRunner correctionRunner;

    public AiCommand(CorrectionRunner correctionRunner) {
        this.correctionRunner = correctionRunner;
    }

    @Override
    public Integer call() {
        RunResult result = correctionRunner.runOnce();
        ConsoleOutput.runResult(result);
        return result.exitCode();
    }
}
