package com.phillippitts.graphicrecorder.exception;

/**
 * Thrown when an analysis, image or meta-summary provider fails or is not configured.
 */
public class ProviderException extends GraphicRecorderException {

    private final String providerName;

    public ProviderException(String providerName, String message) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public ProviderException(String providerName, String message, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
