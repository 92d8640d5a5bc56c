package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Settings for the {@code report.zip} meeting export.
 */
@ConfigurationProperties(prefix = "recording.report")
@Validated
public class ReportProperties {

    /** Budget for images and captures bundled into one report (default 512 MiB). */
    @Positive(message = "Max media bytes must be positive")
    private long maxMediaBytes = 512L * 1024 * 1024;

    /** Zone used for timestamps in {@code report.md} and the archive name. */
    @NotBlank
    private String timeZone = "Asia/Tokyo";

    public long getMaxMediaBytes() {
        return maxMediaBytes;
    }

    public void setMaxMediaBytes(long maxMediaBytes) {
        this.maxMediaBytes = maxMediaBytes;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }
}
