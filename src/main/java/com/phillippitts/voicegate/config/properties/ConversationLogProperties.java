package com.phillippitts.voicegate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Batching settings for conversation turn capture.
 */
@ConfigurationProperties(prefix = "voice.conversation")
@Validated
public class ConversationLogProperties {

    /** Timer flush period in milliseconds. */
    @Positive
    private long flushIntervalMs = 2000;

    /** Queue size that triggers an immediate flush. */
    @Positive
    private int maxBatchSize = 50;

    /** Run keyword annotation on captured turns. */
    private boolean annotationsEnabled = true;

    /** Failed whole-batch writes before the batch is retried turn by turn. */
    @Positive
    private int maxFlushAttempts = 3;

    /** Pending turns above this count report the capture pipeline as degraded. */
    @Positive
    private int backlogWarnThreshold = 1000;

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public void setFlushIntervalMs(long flushIntervalMs) {
        this.flushIntervalMs = flushIntervalMs;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public boolean isAnnotationsEnabled() {
        return annotationsEnabled;
    }

    public void setAnnotationsEnabled(boolean annotationsEnabled) {
        this.annotationsEnabled = annotationsEnabled;
    }

    public int getMaxFlushAttempts() {
        return maxFlushAttempts;
    }

    public void setMaxFlushAttempts(int maxFlushAttempts) {
        this.maxFlushAttempts = maxFlushAttempts;
    }

    public int getBacklogWarnThreshold() {
        return backlogWarnThreshold;
    }

    public void setBacklogWarnThreshold(int backlogWarnThreshold) {
        this.backlogWarnThreshold = backlogWarnThreshold;
    }
}
