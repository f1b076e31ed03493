package com.proofline.core.sync;

import com.proofline.core.lifecycle.ClaimLostException;
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
import java.util.Map;

/**
 * Re-walks the already fetched id range and refreshes rows whose source text
 * changed. Status and earlier corrections of refreshed rows are kept.
 * <p>
 * Uses its own cursor, {@code resync_marker_id}, so an interrupted resync
 * resumes where it stopped without disturbing the fetch cursor. Pages are
 * written under the caller's claim token, as in {@link FetchEngine}.
 */
@Service
public class ResyncEngine {

    private static final Logger log = LoggerFactory.getLogger(ResyncEngine.class);

    private final TaskRepository tasks;
    private final TaskItemRepository items;
    private final TransactionTemplate transactions;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public ResyncEngine(TaskRepository tasks, TaskItemRepository items, TransactionTemplate transactions,
                        PipelineMetrics metrics, Clock clock) {
        this.tasks = tasks;
        this.items = items;
        this.transactions = transactions;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ResyncOutcome resync(Task task, String claimToken, int batchSize, SourceReader source) {
        long taskId = task.id();
        String hashMethod = task.hashMethodOrDefault();
        long ceiling = task.markerMaxId();
        long cursor = task.resyncMarkerId() >= ceiling ? 0L : task.resyncMarkerId();
        try {
            ContentHasher.requireSupported(hashMethod);
            log.info("Task {}: resync from id {} up to {}", taskId, cursor, ceiling);
            int batches = 0;
            long rowsRead = 0;
            long updated = 0;
            while (cursor < ceiling) {
                List<SourceRow> rows = source.page(cursor, ceiling, batchSize);
                if (rows.isEmpty()) {
                    break;
                }
                int batchUpdated = applyPage(taskId, claimToken, hashMethod, rows);
                long last = rows.get(rows.size() - 1).remoteId();
                batches++;
                rowsRead += rows.size();
                updated += batchUpdated;
                metrics.recordResyncBatch(rows.size(), batchUpdated);
                log.debug("Task {}: resync page {} -> {}, {} changed", taskId, cursor, last, batchUpdated);
                cursor = last;
                if (rows.size() < batchSize) {
                    break;
                }
            }

            long finalUpdated = updated;
            long finalRows = rowsRead;
            transactions.executeWithoutResult(status -> {
                tasks.appendDescription(taskId, "Resync finished: " + finalRows + " rows compared, "
                        + finalUpdated + " updated");
                if (!tasks.finishResync(taskId, claimToken, ceiling)) {
                    throw new ClaimLostException(taskId);
                }
            });
            log.info("Task {}: resync finished, {} of {} rows updated", taskId, updated, rowsRead);
            return new ResyncOutcome(batches, rowsRead, updated);
        } catch (RuntimeException e) {
            log.error("Task {}: resync failed: {}", taskId, e.getMessage(), e);
            tasks.appendError(taskId, "Resync failed: " + e.getMessage());
            throw e;
        }
    }

    private int applyPage(long taskId, String claimToken, String hashMethod, List<SourceRow> rows) {
        List<Long> ids = rows.stream().map(SourceRow::remoteId).toList();
        long last = rows.get(rows.size() - 1).remoteId();
        Integer updated = transactions.execute(status -> {
            Map<Long, String> stored = items.hashesByRemoteId(taskId, ids);
            List<HashedRow> changed = new ArrayList<>();
            for (SourceRow row : rows) {
                String storedHash = stored.get(row.remoteId());
                if (storedHash == null && !stored.containsKey(row.remoteId())) {
                    // not fetched yet; the fetch pass that follows will pick it up
                    continue;
                }
                String hash = ContentHasher.hash(row.textValue(), hashMethod);
                if (!hash.equals(storedHash)) {
                    changed.add(new HashedRow(row.remoteId(), row.textValue(), hash));
                }
            }
            items.refreshText(taskId, changed, clock.instant());
            if (!tasks.recordResyncBatch(taskId, claimToken, clock.instant(), last, changed.size())) {
                throw new ClaimLostException(taskId);
            }
            if (!changed.isEmpty()) {
                tasks.appendDescription(taskId, "Resync updated " + changed.size() + " rows up to id " + last);
            }
            return changed.size();
        });
        return updated == null ? 0 : updated;
    }
}
