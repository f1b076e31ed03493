package com.proofline.dispatch.cli;

import com.proofline.core.model.Task;
import com.proofline.core.model.TaskRunStatus;
import com.proofline.core.persistence.TaskRepository;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: proofline status [task-id]
 * <p>
 * Without an id lists all tasks; with one shows its counters, cursors and logs.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task progress")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Task ID")
    private Long taskId;

    @Option(names = {"--log-lines"}, description = "Trailing description and error lines to show (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int logLines;

    private final TaskRepository tasks;

    public StatusCommand(TaskRepository tasks) {
        this.tasks = tasks;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (taskId == null) {
            return listTasks();
        }
        Optional<Task> found = tasks.findById(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return 1;
        }
        showTask(found.get());
        return 0;
    }

    private int listTasks() {
        List<Task> all = tasks.findAll();
        if (all.isEmpty()) {
            ConsoleOutput.info("No tasks defined");
            return 0;
        }
        ConsoleOutput.taskTableHeader();
        all.forEach(ConsoleOutput::taskRow);
        return 0;
    }

    private void showTask(Task task) {
        System.out.println();
        System.out.println("TASK " + task.id() + "  " + task.tableName() + "." + task.columnName()
                + " (id column " + task.idColumnName() + ", hash " + task.hashMethodOrDefault() + ")");
        if (task.status() == TaskRunStatus.ERROR) {
            ConsoleOutput.error("Stage: " + task.stage().dbValue() + " | last run failed");
        } else {
            ConsoleOutput.info("Stage: " + task.stage().dbValue() + " | " + task.status().dbValue());
        }
        System.out.printf("  Records:  %d total, %d fetched, %d new, %d updated, %d processed%n",
                task.recordsTotal(), task.recordsFetched(), task.recordsNew(), task.recordsUpdated(),
                task.recordsProcessed());
        System.out.printf("  Progress: sync %.2f%%, ai %.2f%%%n", task.syncProgress(), task.aiProgress());
        System.out.printf("  Cursors:  fetch %d, resync %d, ceiling %d%n",
                task.markerId(), task.resyncMarkerId(), task.markerMaxId());
        if (task.aiModelId() != null) {
            System.out.println("  Model:    " + task.aiModelId());
        }
        printTail("Description", task.description(), false);
        printTail("Errors", task.errorLog(), true);
    }

    private void printTail(String title, String log, boolean errors) {
        if (log == null || log.isBlank()) {
            return;
        }
        String[] lines = log.split("\n");
        int from = Math.max(0, lines.length - logLines);
        System.out.println();
        System.out.println(title + (from > 0 ? " (last " + (lines.length - from) + " of " + lines.length + ")" : "") + ":");
        for (int i = from; i < lines.length; i++) {
            if (errors) {
                ConsoleOutput.error("  " + lines[i]);
            } else {
                System.out.println("  " + lines[i]);
            }
        }
    }
}
