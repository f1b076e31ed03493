package com.proofline.core.engine;

import com.proofline.core.config.ProoflineProperties;
import com.proofline.core.lifecycle.TaskLifecycle;
import com.proofline.core.lifecycle.TaskLifecycle.Claim;
import com.proofline.core.logging.MdcContext;
import com.proofline.core.metrics.PipelineMetrics;
import com.proofline.core.model.DatabaseConnection;
import com.proofline.core.model.Task;
import com.proofline.core.model.TaskStage;
import com.proofline.core.persistence.DatabaseConnectionRepository;
import com.proofline.core.persistence.TaskRepository;
import com.proofline.core.source.SourceAccessException;
import com.proofline.core.source.SourceConnectionFactory;
import com.proofline.core.source.SourceReader;
import com.proofline.core.sync.FetchEngine;
import com.proofline.core.sync.FetchOutcome;
import com.proofline.core.sync.ResyncEngine;
import com.proofline.core.sync.ResyncOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * One sync invocation: claim the oldest task in {@code new}, {@code fetch} or
 * {@code resync}, bring its local copy up to date, release it.
 * <p>
 * A resync pass is followed by a fetch pass in the same invocation so ids
 * added beyond the old ceiling are picked up.
 */
@Service
public class SyncRunner {

    private static final Logger log = LoggerFactory.getLogger(SyncRunner.class);

    private final TaskLifecycle lifecycle;
    private final TaskRepository tasks;
    private final DatabaseConnectionRepository connections;
    private final SourceConnectionFactory sources;
    private final FetchEngine fetchEngine;
    private final ResyncEngine resyncEngine;
    private final ProoflineProperties properties;
    private final PipelineMetrics metrics;

    public SyncRunner(TaskLifecycle lifecycle, TaskRepository tasks, DatabaseConnectionRepository connections,
                      SourceConnectionFactory sources, FetchEngine fetchEngine, ResyncEngine resyncEngine,
                      ProoflineProperties properties, PipelineMetrics metrics) {
        this.lifecycle = lifecycle;
        this.tasks = tasks;
        this.connections = connections;
        this.sources = sources;
        this.fetchEngine = fetchEngine;
        this.resyncEngine = resyncEngine;
        this.properties = properties;
        this.metrics = metrics;
    }

    public RunResult runOnce() {
        MdcContext.setRunner("sync");
        try {
            Optional<Claim> claimed = lifecycle.claimForSync();
            if (claimed.isEmpty()) {
                log.info("No task waiting for sync");
                metrics.recordRun("sync", "idle");
                return RunResult.idle("No task waiting for sync");
            }
            Claim claim = claimed.get();
            MdcContext.setTask(claim.task());
            boolean failed = true;
            try {
                RunResult result = runClaimed(claim);
                failed = result.outcome() == RunResult.Outcome.FAILED;
                metrics.recordRun("sync", result.outcome().name().toLowerCase(Locale.ROOT));
                return result;
            } finally {
                lifecycle.release(claim, failed);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private RunResult runClaimed(Claim claim) {
        Task task = claim.task();
        long taskId = task.id();
        if (task.databaseConnectionId() == null) {
            tasks.appendError(taskId, "Task has no source database connection");
            return RunResult.failed(taskId, "Task " + taskId + " has no source database connection");
        }
        Optional<DatabaseConnection> database = connections.findById(task.databaseConnectionId());
        if (database.isEmpty()) {
            tasks.appendError(taskId, "Source database connection " + task.databaseConnectionId() + " not found");
            return RunResult.failed(taskId, "Source database connection " + task.databaseConnectionId() + " not found");
        }

        SourceReader source;
        try {
            source = sources.open(database.get(), task);
        } catch (SourceAccessException e) {
            log.error("Task {}: {}", taskId, e.getMessage());
            return RunResult.unreachable(taskId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Task {}: cannot prepare source: {}", taskId, e.getMessage());
            tasks.appendError(taskId, "Cannot prepare source: " + e.getMessage());
            return RunResult.failed(taskId, e.getMessage());
        }

        int batchSize = properties.getSyncBatchSize();
        try (source) {
            Task current = task;
            String resyncNote = "";
            if (task.stage() == TaskStage.RESYNC) {
                ResyncOutcome resync = resyncEngine.resync(task, claim.token(), batchSize, source);
                resyncNote = "resync updated " + resync.updated() + " of " + resync.rows() + " rows; ";
                current = tasks.findById(taskId).orElse(task);
            }
            FetchOutcome fetch = fetchEngine.fetch(current, claim.token(), batchSize, source);
            String message = "Task " + taskId + ": " + resyncNote + "fetched " + fetch.rows() + " rows ("
                    + fetch.inserted() + " new), stage " + fetch.progress().stage().dbValue()
                    + ", sync " + fetch.progress().syncProgress() + "%";
            log.info(message);
            return RunResult.completed(taskId, fetch.progress(), message);
        } catch (RuntimeException e) {
            // already appended to the task's error log by the engine
            return RunResult.failed(taskId, "Task " + taskId + ": " + e.getMessage());
        }
    }
}
