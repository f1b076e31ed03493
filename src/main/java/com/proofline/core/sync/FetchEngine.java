package com.proofline.core.sync;

import com.proofline.core.lifecycle.ClaimLostException;
import com.proofline.core.lifecycle.ProgressAccountant;
import com.proofline.core.lifecycle.ProgressSummary;
import com.proofline.core.metrics.PipelineMetrics;
import com.proofline.core.model.Task;
import com.proofline.core.persistence.TaskItemRepository;
import com.proofline.core.persistence.TaskItemRepository.HashedRow;
import com.proofline.core.persistence.TaskRepository;
import com.proofline.core.source.SourceReader;
import com.proofline.core.source.SourceRow;
import com.proofline.core.text.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Copies source rows past the task's fetch cursor into the local store.
 * <p>
 * Each page is applied in one transaction together with the cursor and
 * counter updates, so a crash between pages re-reads at most the page in
 * flight and the upsert makes that re-read harmless. Every page is written
 * under the caller's claim token; a runner whose claim was taken over fails
 * with {@link ClaimLostException} and its page rolls back.
 */
@Service
public class FetchEngine {

    private static final Logger log = LoggerFactory.getLogger(FetchEngine.class);

    private final TaskRepository tasks;
    private final TaskItemRepository items;
    private final ProgressAccountant accountant;
    private final TransactionTemplate transactions;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public FetchEngine(TaskRepository tasks, TaskItemRepository items, ProgressAccountant accountant,
                       TransactionTemplate transactions, PipelineMetrics metrics, Clock clock) {
        this.tasks = tasks;
        this.items = items;
        this.accountant = accountant;
        this.transactions = transactions;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs one fetch pass for {@code task}.
     * <p>
     * On failure the page in flight is rolled back, the message is appended to
     * the task's error log and the exception is rethrown. A resync requested
     * while the source was being sized wins: the pass stops before any page.
     */
    public FetchOutcome fetch(Task task, String claimToken, int batchSize, SourceReader source) {
        long taskId = task.id();
        String hashMethod = task.hashMethodOrDefault();
        try {
            ContentHasher.requireSupported(hashMethod);
            source.probe();
            long total = source.count();
            long ceiling = source.maxId();
            Boolean started = transactions.execute(status ->
                    tasks.startFetch(taskId, claimToken, clock.instant(), total, ceiling));
            if (!Boolean.TRUE.equals(started)) {
                if (!tasks.holdsClaim(taskId, claimToken)) {
                    throw new ClaimLostException(taskId);
                }
                log.info("Task {}: left the fetch stage before the pass started", taskId);
                tasks.appendDescription(taskId, "Fetch deferred, task moved to "
                        + tasks.findById(taskId).map(t -> t.stage().dbValue()).orElse("?"));
                return new FetchOutcome(0, 0, 0, task.markerId(), accountant.recompute(taskId));
            }
            log.info("Task {}: source has {} rows, max id {}, cursor at {}", taskId, total, ceiling, task.markerId());

            long current = task.markerId();
            int batches = 0;
            long rowsRead = 0;
            long inserted = 0;
            if (ceiling <= current) {
                tasks.appendDescription(taskId, "No new records to fetch (max id " + ceiling + ")");
            }
            while (current < ceiling) {
                List<SourceRow> rows = source.page(current, ceiling, batchSize);
                if (rows.isEmpty()) {
                    tasks.appendDescription(taskId, "No records returned after id " + current + ", stopping");
                    break;
                }
                int batchInserted = applyPage(taskId, claimToken, hashMethod, rows);
                long last = rows.get(rows.size() - 1).remoteId();
                batches++;
                rowsRead += rows.size();
                inserted += batchInserted;
                metrics.recordFetchBatch(rows.size(), batchInserted);
                log.info("Task {}: fetched {} rows ({} new), cursor {} -> {}",
                        taskId, rows.size(), batchInserted, current, last);
                current = last;
                if (rows.size() < batchSize) {
                    break;
                }
            }

            ProgressSummary progress = accountant.recompute(taskId);
            return new FetchOutcome(batches, rowsRead, inserted, current, progress);
        } catch (RuntimeException e) {
            log.error("Task {}: fetch failed: {}", taskId, e.getMessage(), e);
            tasks.appendError(taskId, "Fetch failed: " + e.getMessage());
            throw e;
        }
    }

    private int applyPage(long taskId, String claimToken, String hashMethod, List<SourceRow> rows) {
        List<HashedRow> hashed = new ArrayList<>(rows.size());
        List<Long> ids = new ArrayList<>(rows.size());
        for (SourceRow row : rows) {
            hashed.add(new HashedRow(row.remoteId(), row.textValue(), ContentHasher.hash(row.textValue(), hashMethod)));
            ids.add(row.remoteId());
        }
        long first = rows.get(0).remoteId();
        long last = rows.get(rows.size() - 1).remoteId();
        Integer inserted = transactions.execute(status -> {
            Set<Long> existing = items.existingRemoteIds(taskId, ids);
            int fresh = (int) ids.stream().distinct().filter(id -> !existing.contains(id)).count();
            items.upsert(taskId, hashed, clock.instant());
            if (!tasks.recordFetchBatch(taskId, claimToken, clock.instant(), last, rows.size(), fresh)) {
                throw new ClaimLostException(taskId);
            }
            tasks.appendDescription(taskId, "Fetched " + rows.size() + " rows (ids " + first + "-" + last
                    + ", " + fresh + " new)");
            return fresh;
        });
        return inserted == null ? 0 : inserted;
    }
}
