package com.phillippitts.graphicrecorder.config.properties;

import com.phillippitts.graphicrecorder.service.audio.PendingAudioLimits;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Caps for audio buffered while the transcription leg is still opening.
 */
@ConfigurationProperties(prefix = "recording.pending-audio")
@Validated
public class PendingAudioProperties {

    /** Maximum number of chunks held before new chunks are dropped. */
    @Positive(message = "Max chunks must be positive")
    private int maxChunks = 100;

    /** Maximum total bytes held before new chunks are dropped (default 4 MiB). */
    @Positive(message = "Max bytes must be positive")
    private long maxBytes = 4L * 1024 * 1024;

    public int getMaxChunks() {
        return maxChunks;
    }

    public void setMaxChunks(int maxChunks) {
        this.maxChunks = maxChunks;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public PendingAudioLimits toLimits() {
        return new PendingAudioLimits(maxChunks, maxBytes);
    }
}
