package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits for recordings uploaded through {@code POST /api/meetings/{id}/audio}.
 */
@ConfigurationProperties(prefix = "recording.audio-upload")
@Validated
public class AudioUploadProperties {

    /** Largest accepted upload (default 256 MiB). Uploads are held in memory, so at most 1 GiB. */
    @Positive(message = "Max bytes must be positive")
    @Max(value = 1L << 30, message = "Max bytes must not exceed 1 GiB")
    private long maxBytes = 256L * 1024 * 1024;

    public long getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }
}
