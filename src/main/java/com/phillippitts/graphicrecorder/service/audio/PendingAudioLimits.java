package com.phillippitts.graphicrecorder.service.audio;

/**
 * Caps for the pending-audio buffer.
 *
 * @param maxChunks maximum number of buffered chunks (must be positive)
 * @param maxBytes  maximum total buffered bytes (must be positive)
 */
public record PendingAudioLimits(int maxChunks, long maxBytes) {
    public PendingAudioLimits {
        if (maxChunks <= 0) {
            throw new IllegalArgumentException("maxChunks must be positive");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
    }
}
