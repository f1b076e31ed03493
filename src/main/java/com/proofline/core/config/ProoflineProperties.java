package com.proofline.core.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline tuning read from {@code proofline.*}.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "proofline")
public class ProoflineProperties {

    /** Source rows read per fetch or resync page. */
    @Min(1)
    private int syncBatchSize = 500;

    /** Pending items sent to the model in one correction cycle. */
    @Min(1)
    private int aiMaxItems = 20;

    /** Pending items read from the local store per query. */
    @Min(1)
    private int aiChunkSize = 10;

    /** A claim older than this is considered abandoned by a crashed invocation. */
    @Min(1)
    private long claimTimeoutMinutes = 30;

    @Min(1)
    private int modelLookupTimeoutSeconds = 10;

    /** Optional system message sent ahead of every correction prompt. */
    @NotNull
    private String systemPrompt = "";

    public int getSyncBatchSize() {
        return syncBatchSize;
    }

    public void setSyncBatchSize(int syncBatchSize) {
        this.syncBatchSize = syncBatchSize;
    }

    public int getAiMaxItems() {
        return aiMaxItems;
    }

    public void setAiMaxItems(int aiMaxItems) {
        this.aiMaxItems = aiMaxItems;
    }

    public int getAiChunkSize() {
        return aiChunkSize;
    }

    public void setAiChunkSize(int aiChunkSize) {
        this.aiChunkSize = aiChunkSize;
    }

    public long getClaimTimeoutMinutes() {
        return claimTimeoutMinutes;
    }

    public void setClaimTimeoutMinutes(long claimTimeoutMinutes) {
        this.claimTimeoutMinutes = claimTimeoutMinutes;
    }

    public int getModelLookupTimeoutSeconds() {
        return modelLookupTimeoutSeconds;
    }

    public void setModelLookupTimeoutSeconds(int modelLookupTimeoutSeconds) {
        this.modelLookupTimeoutSeconds = modelLookupTimeoutSeconds;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }
}
