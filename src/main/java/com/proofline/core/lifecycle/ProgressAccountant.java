package com.proofline.core.lifecycle;

import com.proofline.core.model.Task;
import com.proofline.core.model.TaskItemStatus;
import com.proofline.core.model.TaskStage;
import com.proofline.core.model.TaskValidationException;
import com.proofline.core.persistence.TaskItemRepository;
import com.proofline.core.persistence.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Recomputes task counters from the item table and applies stage transitions
 * in the same transaction, so a transition is never persisted without the
 * counts that justify it.
 */
@Service
public class ProgressAccountant {

    private static final Logger log = LoggerFactory.getLogger(ProgressAccountant.class);

    private final TaskRepository tasks;
    private final TaskItemRepository items;
    private final TransactionTemplate transactions;

    public ProgressAccountant(TaskRepository tasks, TaskItemRepository items, TransactionTemplate transactions) {
        this.tasks = tasks;
        this.items = items;
        this.transactions = transactions;
    }

    public ProgressSummary recompute(long taskId) {
        return transactions.execute(status -> {
            Task task = tasks.findById(taskId)
                    .orElseThrow(() -> new TaskValidationException("Task " + taskId + " not found"));
            long fetched = items.countForTask(taskId);
            Map<TaskItemStatus, Long> counts = items.countByStatus(taskId);
            long pending = counts.get(TaskItemStatus.PENDING);
            long changed = counts.get(TaskItemStatus.CHANGED);
            long unchanged = counts.get(TaskItemStatus.UNCHANGED);
            long processed = changed + unchanged;
            long total = task.recordsTotal();

            double syncProgress = percent(fetched, total);
            double aiProgress = percent(processed, total);
            TaskStage next = TaskLifecycle.nextStage(task.stage(), total, fetched, processed);

            tasks.updateProgress(taskId, fetched, processed, syncProgress, aiProgress, next);
            if (next != task.stage()) {
                tasks.appendDescription(taskId, "Stage " + task.stage().dbValue() + " -> " + next.dbValue());
                log.info("Task {} advanced from {} to {}", taskId, task.stage().dbValue(), next.dbValue());
            }
            return new ProgressSummary(pending, changed, unchanged, syncProgress, aiProgress, next);
        });
    }

    /** Percentage with two decimals, 0 when the total is unknown. */
    static double percent(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
