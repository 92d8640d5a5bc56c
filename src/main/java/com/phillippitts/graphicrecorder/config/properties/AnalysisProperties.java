package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * When an analysis pass runs during a recording session.
 */
@ConfigurationProperties(prefix = "recording.analysis")
@Validated
public class AnalysisProperties {

    /** Run an analysis at least this often while new transcript text exists (default 5 min). */
    @Positive(message = "Interval must be positive")
    private long intervalMs = 300_000;

    /** Run an analysis early once this many words accumulated since the last one. */
    @Positive(message = "Word threshold must be positive")
    private int wordThreshold = 500;

    /** Period of the timer that re-evaluates the trigger between transcript events. */
    @Positive(message = "Check interval must be positive")
    private long checkIntervalMs = 30_000;

    /** Number of most recent camera frames kept per session. */
    @Positive(message = "Camera frame buffer size must be positive")
    private int cameraFrameBufferSize = 5;

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public int getWordThreshold() {
        return wordThreshold;
    }

    public void setWordThreshold(int wordThreshold) {
        this.wordThreshold = wordThreshold;
    }

    public long getCheckIntervalMs() {
        return checkIntervalMs;
    }

    public void setCheckIntervalMs(long checkIntervalMs) {
        this.checkIntervalMs = checkIntervalMs;
    }

    public int getCameraFrameBufferSize() {
        return cameraFrameBufferSize;
    }

    public void setCameraFrameBufferSize(int cameraFrameBufferSize) {
        this.cameraFrameBufferSize = cameraFrameBufferSize;
    }
}
