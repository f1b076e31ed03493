package com.proofline.core.reconcile;

import com.proofline.core.metrics.PipelineMetrics;
import com.proofline.core.model.IdentifierScheme;
import com.proofline.core.model.TaskValidationException;
import com.proofline.core.persistence.TaskItemRepository;
import com.proofline.core.persistence.TaskRepository;
import com.proofline.core.text.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a parsed model reply back onto the task's items.
 * <p>
 * The reply is applied all-or-nothing: one invalid element (no identifier, no
 * {@code text_corrected}, an identifier that was not in the prompt, or one
 * that appears twice) rolls back the whole batch, the error goes to the
 * task's error log and the items stay pending for the next run.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final TaskRepository tasks;
    private final TaskItemRepository items;
    private final TransactionTemplate transactions;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public ReconciliationEngine(TaskRepository tasks, TaskItemRepository items, TransactionTemplate transactions,
                                PipelineMetrics metrics, Clock clock) {
        this.tasks = tasks;
        this.items = items;
        this.transactions = transactions;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Applies {@code response} to the task's items.
     * <p>
     * Token counts are split evenly by floor division; the remainder of an
     * uneven split is not attributed to any item.
     *
     * @param expectedIdentifiers identifiers sent in the prompt; empty disables the check
     * @param configuredModel     model name recorded when the reply carries none
     * @return number of item rows actually updated
     * @throws TaskValidationException when any element is invalid
     */
    public int reconcile(long taskId, List<ResponseItem> response, Set<String> expectedIdentifiers,
                         long tokensIn, long tokensOut, OriginalTexts originalTexts,
                         String modelName, String configuredModel, String finishReason) {
        if (response.isEmpty()) {
            return 0;
        }
        String recordedModel = modelName == null || modelName.isBlank() ? configuredModel : modelName;
        long perItemIn = tokensIn / response.size();
        long perItemOut = tokensOut / response.size();
        Instant now = clock.instant();
        try {
            Integer updated = transactions.execute(status -> {
                Set<String> seen = new HashSet<>();
                int count = 0;
                for (ResponseItem element : response) {
                    count += apply(taskId, element, expectedIdentifiers, seen, originalTexts,
                            perItemIn, perItemOut, recordedModel, finishReason, now);
                }
                return count;
            });
            int result = updated == null ? 0 : updated;
            metrics.recordReconciled(result);
            log.info("Task {}: reconciled {} of {} response items", taskId, result, response.size());
            return result;
        } catch (RuntimeException e) {
            metrics.recordReconcileRejected();
            log.error("Task {}: response rejected: {}", taskId, e.getMessage());
            tasks.appendError(taskId, "AI response rejected: " + e.getMessage());
            throw e;
        }
    }

    private int apply(long taskId, ResponseItem element, Set<String> expected, Set<String> seen,
                      OriginalTexts originalTexts, long tokensIn, long tokensOut,
                      String model, String finishReason, Instant now) {
        IdentifierScheme scheme;
        String identifier;
        if (element.remoteId() != null) {
            scheme = IdentifierScheme.REMOTE_ID;
            identifier = element.remoteId();
        } else if (element.taskItemId() != null) {
            scheme = IdentifierScheme.TASK_ITEM_ID;
            identifier = element.taskItemId();
        } else if (element.id() != null) {
            scheme = IdentifierScheme.TASK_ITEM_ID;
            identifier = element.id();
        } else {
            throw new TaskValidationException("Response element has no remote_id or id");
        }
        if (element.textCorrected() == null) {
            throw new TaskValidationException("Response element " + identifier + " has no text_corrected");
        }
        if (!expected.isEmpty() && !expected.contains(identifier)) {
            throw new TaskValidationException("Response element " + identifier + " was not part of the request");
        }
        if (!seen.add(identifier)) {
            throw new TaskValidationException("Response element " + identifier + " appears more than once");
        }
        long key;
        try {
            key = Long.parseLong(identifier);
        } catch (NumberFormatException e) {
            throw new TaskValidationException("Response identifier is not numeric: " + identifier, e);
        }

        String corrected = element.textCorrected();
        if (corrected.isEmpty()) {
            return items.markUnchanged(taskId, scheme, key, tokensIn, tokensOut, model, finishReason, now);
        }
        String original = originalText(taskId, scheme, identifier, key, element, originalTexts);
        double score = TextSimilarity.score(original, corrected);
        return items.markChanged(taskId, scheme, key, corrected, score, tokensIn, tokensOut,
                model, finishReason, now);
    }

    private String originalText(long taskId, IdentifierScheme scheme, String identifier, long key,
                                ResponseItem element, OriginalTexts originalTexts) {
        String original = originalTexts.lookup(scheme, identifier);
        if (original == null && scheme == IdentifierScheme.REMOTE_ID) {
            String alternate = element.taskItemId() != null ? element.taskItemId() : element.id();
            original = originalTexts.lookup(IdentifierScheme.TASK_ITEM_ID, alternate);
        }
        if (original == null) {
            original = items.findOriginalText(taskId, scheme, key).orElse("");
        }
        return original;
    }
}
