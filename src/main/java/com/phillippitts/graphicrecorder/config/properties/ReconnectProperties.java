package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Reconnect behaviour of the client-side {@code ConnectionLifecycle}.
 */
@ConfigurationProperties(prefix = "client.reconnect")
@Validated
public class ReconnectProperties {

    /** When false, an unexpected close leaves the client disconnected. */
    private boolean enabled = true;

    /** A socket still connecting after this long is force-closed; 0 disables the watchdog. */
    @Min(0)
    private long connectTimeoutMs = 4_000;

    @Min(0)
    private long initialBackoffMs = 250;

    @Min(0)
    private long maxBackoffMs = 10_000;

    /** Fraction of the capped delay applied as uniform +/- jitter. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterRatio = 0.2;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }
}
