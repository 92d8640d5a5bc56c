package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Endpoint and per-connection send limits for the recording WebSocket.
 */
@ConfigurationProperties(prefix = "recording.websocket")
@Validated
public class WebSocketProperties {

    @NotBlank
    private String path = "/ws/recording";

    /** Origins allowed to open the socket; empty means same-origin only. */
    private List<String> allowedOrigins = new ArrayList<>();

    /** A send that blocks longer than this closes the connection. */
    @Positive
    private int sendTimeLimitMs = 10_000;

    /** Bytes buffered for a slow viewer before the connection is closed. */
    @Positive
    private int sendBufferSizeLimit = 8 * 1024 * 1024;

    /** Largest accepted binary (audio) frame. */
    @Positive
    private int maxBinaryMessageBytes = 1024 * 1024;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    public int getMaxBinaryMessageBytes() {
        return maxBinaryMessageBytes;
    }

    public void setMaxBinaryMessageBytes(int maxBinaryMessageBytes) {
        this.maxBinaryMessageBytes = maxBinaryMessageBytes;
    }
}
