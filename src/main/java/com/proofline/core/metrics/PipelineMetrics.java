package com.proofline.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the sync and correction pipeline.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordFetchBatch(int rows, int inserted) {
        Counter.builder("proofline.fetch.rows")
                .register(registry)
                .increment(rows);
        Counter.builder("proofline.fetch.inserted")
                .register(registry)
                .increment(inserted);
    }

    public void recordResyncBatch(int rows, int updated) {
        Counter.builder("proofline.resync.rows")
                .register(registry)
                .increment(rows);
        Counter.builder("proofline.resync.updated")
                .register(registry)
                .increment(updated);
    }

    /**
     * Records one model call.
     *
     * @param provider provider name as configured, e.g. "OpenAI"
     * @param success  false when the provider raised an error
     */
    public void recordAiCall(String provider, long ms, boolean success) {
        Timer.builder("proofline.ai.duration")
                .tag("provider", provider)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTokens(String provider, long tokensIn, long tokensOut) {
        DistributionSummary.builder("proofline.ai.tokens")
                .tag("provider", provider)
                .tag("direction", "input")
                .register(registry)
                .record(tokensIn);
        DistributionSummary.builder("proofline.ai.tokens")
                .tag("provider", provider)
                .tag("direction", "output")
                .register(registry)
                .record(tokensOut);
    }

    public void recordReconciled(int updated) {
        Counter.builder("proofline.reconcile.items")
                .register(registry)
                .increment(updated);
    }

    public void recordReconcileRejected() {
        Counter.builder("proofline.reconcile.rejected")
                .description("Model responses rejected by validation")
                .register(registry)
                .increment();
    }

    /**
     * @param runner  "sync" or "ai"
     * @param outcome run outcome name, e.g. "completed"
     */
    public void recordRun(String runner, String outcome) {
        Counter.builder("proofline.runs.total")
                .tag("runner", runner)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
