package com.phillippitts.graphicrecorder.exception;

/**
 * Thrown when the transcription leg cannot be opened or fails mid-stream.
 */
public class TranscriptionException extends GraphicRecorderException {

    private final String providerName;

    public TranscriptionException(String message) {
        super(message);
        this.providerName = "unknown";
    }

    public TranscriptionException(String message, String providerName) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public TranscriptionException(String message, String providerName, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
