package com.proofline.core.lifecycle;

import com.proofline.core.config.ProoflineProperties;
import com.proofline.core.model.Task;
import com.proofline.core.model.TaskRunStatus;
import com.proofline.core.model.TaskStage;
import com.proofline.core.persistence.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Task state machine: which task a runner may work on, and where it goes next.
 * <p>
 * {@code new -> fetch -> {resync ->} fetch -> ai -> export -> done}. Only the
 * resync branch moves a task backwards, and only on operator request.
 */
@Service
public class TaskLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycle.class);

    private final TaskRepository tasks;
    private final Clock clock;
    private final Duration claimTimeout;

    public TaskLifecycle(TaskRepository tasks, ProoflineProperties properties, Clock clock) {
        this.tasks = tasks;
        this.clock = clock;
        this.claimTimeout = Duration.ofMinutes(properties.getClaimTimeoutMinutes());
    }

    /**
     * A task claimed by this invocation, released with {@link #release}.
     */
    public record Claim(Task task, String token) {
    }

    public Optional<Claim> claimForSync() {
        return claim(TaskStage.SYNC_ELIGIBLE);
    }

    public Optional<Claim> claimForCorrection() {
        return claim(TaskStage.AI_ELIGIBLE);
    }

    private Optional<Claim> claim(Set<TaskStage> stages) {
        String token = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Optional<Task> claimed = tasks.claimOldest(stages, token, now, now.minus(claimTimeout));
        claimed.ifPresent(task -> log.info("Claimed task {} in stage {}", task.id(), task.stage().dbValue()));
        return claimed.map(task -> new Claim(task, token));
    }

    /**
     * Releases a claim; {@code failed} marks the task with {@code status = error}
     * so operators can spot it, while keeping it eligible for the next run.
     */
    public void release(Claim claim, boolean failed) {
        TaskRunStatus status = failed ? TaskRunStatus.ERROR : TaskRunStatus.IDLE;
        if (!tasks.release(claim.task().id(), claim.token(), status)) {
            log.warn("Claim on task {} was lost before release", claim.task().id());
        }
    }

    /**
     * Operator request to re-walk the fetched range for changed source texts.
     *
     * @return false when the task is unknown or not in a stage that allows resync
     */
    public boolean requestResync(long taskId) {
        boolean moved = tasks.requestResync(taskId);
        if (moved) {
            tasks.appendDescription(taskId, "Resync requested");
            log.info("Task {} moved to resync", taskId);
        }
        return moved;
    }

    /**
     * Stage after a recount. Fetch completes when every source row is stored
     * locally, correction when every stored row has an outcome. An empty
     * source never completes fetch.
     */
    public static TaskStage nextStage(TaskStage current, long recordsTotal, long recordsFetched, long processed) {
        if (recordsTotal <= 0) {
            return current;
        }
        return switch (current) {
            case NEW, FETCH -> recordsFetched == recordsTotal ? TaskStage.AI : current;
            case AI -> processed == recordsTotal ? TaskStage.EXPORT : current;
            default -> current;
        };
    }
}
