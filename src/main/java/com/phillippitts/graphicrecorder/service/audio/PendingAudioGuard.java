package com.phillippitts.graphicrecorder.service.audio;

import java.util.Objects;

/**
 * Admission control for audio arriving before the transcription leg is ready.
 *
 * <p>Only admits or refuses; it never evicts chunks that are already buffered, so
 * everything buffered so far stays complete and in order. The chunk-count check runs
 * first: a full buffer reports {@link DropReason#MAX_CHUNKS} even when the bytes
 * would still fit.
 */
public final class PendingAudioGuard {

    private PendingAudioGuard() {}

    /**
     * Decides whether a chunk of {@code incomingBytes} may join a buffer currently holding
     * {@code pendingChunks} chunks totalling {@code pendingBytes}.
     */
    public static Admission admit(long incomingBytes, int pendingChunks, long pendingBytes, PendingAudioLimits limits) {
        Objects.requireNonNull(limits, "limits");
        if (pendingChunks >= limits.maxChunks()) {
            return Admission.rejected(DropReason.MAX_CHUNKS);
        }
        if (pendingBytes + incomingBytes > limits.maxBytes()) {
            return Admission.rejected(DropReason.MAX_BYTES);
        }
        return Admission.accepted();
    }
}
