package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing of the hierarchical analysis context and the meta-summary compaction gate.
 */
@ConfigurationProperties(prefix = "recording.context")
@Validated
public class ContextProperties {

    /** Most recent analyses included in the short-term tier. */
    @Min(value = 0, message = "Recent analyses count must be >= 0")
    private int recentAnalysesCount = 3;

    /** Most recent generated images included in the short-term tier. */
    @Min(value = 0, message = "Recent images count must be >= 0")
    private int recentImagesCount = 3;

    @Valid
    private MetaSummary metaSummary = new MetaSummary();

    public int getRecentAnalysesCount() {
        return recentAnalysesCount;
    }

    public void setRecentAnalysesCount(int recentAnalysesCount) {
        this.recentAnalysesCount = recentAnalysesCount;
    }

    public int getRecentImagesCount() {
        return recentImagesCount;
    }

    public void setRecentImagesCount(int recentImagesCount) {
        this.recentImagesCount = recentImagesCount;
    }

    public MetaSummary getMetaSummary() {
        return metaSummary;
    }

    public void setMetaSummary(MetaSummary metaSummary) {
        this.metaSummary = metaSummary;
    }

    /**
     * Compaction gate: enough new analyses AND (no meta-summary yet OR interval elapsed).
     */
    public static class MetaSummary {

        @Positive(message = "Session threshold must be positive")
        private int sessionThreshold = 6;

        @Positive(message = "Meta-summary interval must be positive")
        private long intervalMs = 30L * 60 * 1000;

        public int getSessionThreshold() {
            return sessionThreshold;
        }

        public void setSessionThreshold(int sessionThreshold) {
            this.sessionThreshold = sessionThreshold;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
