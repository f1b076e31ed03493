package com.proofline.dispatch.cli;

import com.proofline.core.engine.RunResult;
import com.proofline.core.engine.SyncRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: proofline sync
 * <p>
 * Claims the oldest task waiting for sync and fetches (or resyncs, then
 * fetches) its source rows.
 */
@Command(name = "sync", mixinStandardHelpOptions = true,
        description = "Fetch new or changed source rows for the oldest waiting task")
@Component
public class SyncCommand implements Callable<Integer> {

    private final SyncRunner syncRunner;

    public SyncCommand(SyncRunner syncRunner) {
        this.syncRunner = syncRunner;
    }

    @Override
    public Integer call() {
        RunResult result = syncRunner.runOnce();
        ConsoleOutput.runResult(result);
        return result.exitCode();
    }
}
