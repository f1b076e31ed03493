package com.proofline.core.engine;

import com.proofline.core.config.ProoflineProperties;
import com.proofline.core.lifecycle.ProgressAccountant;
import com.proofline.core.lifecycle.ProgressSummary;
import com.proofline.core.lifecycle.TaskLifecycle;
import com.proofline.core.lifecycle.TaskLifecycle.Claim;
import com.proofline.core.llm.AiGateway;
import com.proofline.core.llm.AiProviderException;
import com.proofline.core.llm.AiRequest;
import com.proofline.core.llm.AiResponse;
import com.proofline.core.llm.PromptBuilder;
import com.proofline.core.llm.RequestOptions;
import com.proofline.core.logging.MdcContext;
import com.proofline.core.metrics.PipelineMetrics;
import com.proofline.core.model.AiModelConfig;
import com.proofline.core.model.Task;
import com.proofline.core.model.TaskItem;
import com.proofline.core.persistence.AiModelRepository;
import com.proofline.core.persistence.TaskItemRepository;
import com.proofline.core.persistence.TaskRepository;
import com.proofline.core.reconcile.OriginalTexts;
import com.proofline.core.reconcile.ReconciliationEngine;
import com.proofline.core.reconcile.ResponseFormatException;
import com.proofline.core.reconcile.ResponseItem;
import com.proofline.core.reconcile.ResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One correction cycle: claim the oldest task in {@code ai}, send a batch of
 * its pending items to the configured model, reconcile the reply, recount.
 * <p>
 * Every failure ends the cycle with the error on the task's log; the items
 * stay pending and the next invocation retries them.
 */
@Service
public class CorrectionRunner {

    private static final Logger log = LoggerFactory.getLogger(CorrectionRunner.class);

    private final TaskLifecycle lifecycle;
    private final TaskRepository tasks;
    private final TaskItemRepository items;
    private final AiModelRepository models;
    private final PromptBuilder promptBuilder;
    private final AiGateway gateway;
    private final ResponseParser responseParser;
    private final ReconciliationEngine reconciliation;
    private final ProgressAccountant accountant;
    private final ProoflineProperties properties;
    private final PipelineMetrics metrics;

    public CorrectionRunner(TaskLifecycle lifecycle, TaskRepository tasks, TaskItemRepository items,
                            AiModelRepository models, PromptBuilder promptBuilder, AiGateway gateway,
                            ResponseParser responseParser, ReconciliationEngine reconciliation,
                            ProgressAccountant accountant, ProoflineProperties properties,
                            PipelineMetrics metrics) {
        this.lifecycle = lifecycle;
        this.tasks = tasks;
        this.items = items;
        this.models = models;
        this.promptBuilder = promptBuilder;
        this.gateway = gateway;
        this.responseParser = responseParser;
        this.reconciliation = reconciliation;
        this.accountant = accountant;
        this.properties = properties;
        this.metrics = metrics;
    }

    public RunResult runOnce() {
        MdcContext.setRunner("ai");
        try {
            Optional<Claim> claimed = lifecycle.claimForCorrection();
            if (claimed.isEmpty()) {
                log.info("No task waiting for correction");
                metrics.recordRun("ai", "idle");
                return RunResult.idle("No task waiting for correction");
            }
            Claim claim = claimed.get();
            MdcContext.setTask(claim.task());
            boolean failed = true;
            try {
                RunResult result = runClaimed(claim.task());
                failed = result.outcome() == RunResult.Outcome.FAILED;
                metrics.recordRun("ai", result.outcome().name().toLowerCase(Locale.ROOT));
                return result;
            } finally {
                lifecycle.release(claim, failed);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private RunResult runClaimed(Task task) {
        long taskId = task.id();
        if (task.aiModelId() == null) {
            return fail(taskId, "Task has no AI model assigned");
        }
        Optional<AiModelConfig> configured = models.findActiveById(task.aiModelId());
        if (configured.isEmpty()) {
            return fail(taskId, "AI model " + task.aiModelId() + " not found or inactive");
        }
        AiModelConfig model = configured.get();

        try {
            if (!gateway.checkModel(model)) {
                return fail(taskId, "Model " + model.modelName() + " of provider " + model.provider()
                        + " is not available");
            }
        } catch (AiProviderException e) {
            return fail(taskId, e.getMessage());
        }

        List<TaskItem> pending = items.findPending(taskId, properties.getAiChunkSize(), properties.getAiMaxItems());
        if (pending.isEmpty()) {
            ProgressSummary progress = accountant.recompute(taskId);
            String message = "Task " + taskId + ": no pending items, stage " + progress.stage().dbValue();
            log.info(message);
            return RunResult.completed(taskId, progress, message);
        }
        List<TaskItem> batch = promptBuilder.fitToInputLimit(pending, task.aiUserRules(), model.maxCharInput());
        OriginalTexts originals = OriginalTexts.of(batch);
        String prompt = promptBuilder.buildPrompt(batch, task.aiUserRules());

        AiResponse response;
        try {
            String systemPrompt = properties.hasSystemPrompt() ? properties.getSystemPrompt() : null;
            RequestOptions options = new RequestOptions(null, null, systemPrompt);
            AiRequest request = gateway.buildRequest(model, prompt, options);
            response = gateway.execute(request);
        } catch (AiProviderException e) {
            return fail(taskId, e.getMessage());
        }

        List<ResponseItem> parsed;
        try {
            parsed = responseParser.parse(response.text());
        } catch (ResponseFormatException e) {
            log.debug("Raw model response: {}", response.raw());
            return fail(taskId, "AI response rejected: " + e.getMessage());
        }

        int updated;
        try {
            updated = reconciliation.reconcile(taskId, parsed, originals.expectedIdentifiers(),
                    response.tokensIn(), response.tokensOut(), originals,
                    response.model(), model.modelName(), response.finishReason());
        } catch (RuntimeException e) {
            // the engine has already written the error log entry
            return RunResult.failed(taskId, "Task " + taskId + ": " + e.getMessage());
        }

        ProgressSummary progress = accountant.recompute(taskId);
        String message = "Task " + taskId + ": " + updated + " of " + batch.size() + " items corrected, "
                + progress.pending() + " pending, stage " + progress.stage().dbValue()
                + ", ai " + progress.aiProgress() + "%";
        log.info(message);
        return RunResult.completed(taskId, progress, message);
    }

    private RunResult fail(long taskId, String error) {
        log.error("Task {}: {}", taskId, error);
        tasks.appendError(taskId, error);
        return RunResult.failed(taskId, "Task " + taskId + ": " + error);
    }
}
