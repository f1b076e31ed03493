package com.proofline.dispatch.cli;

import com.proofline.core.lifecycle.TaskLifecycle;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: proofline resync &lt;task-id&gt;
 */
@Command(name = "resync", mixinStandardHelpOptions = true,
        description = "Re-check already fetched rows of a task for source changes on the next sync")
@Component
public class ResyncCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private long taskId;

    private final TaskLifecycle lifecycle;

    public ResyncCommand(TaskLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        if (lifecycle.requestResync(taskId)) {
            ConsoleOutput.success("Task " + taskId + " will be resynced on the next sync run");
            return 0;
        }
        ConsoleOutput.error("Task " + taskId + " not found or not in a stage that can be resynced "
                + "(fetch, ai, export, done)");
        return 1;
    }
}
