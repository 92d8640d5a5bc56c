package com.phillippitts.graphicrecorder.service.provider;

import java.util.concurrent.CompletableFuture;

/**
 * Opens streaming transcription legs.
 *
 * <p>The returned future completes once the leg is ready to accept audio, or exceptionally
 * with a {@link com.phillippitts.graphicrecorder.exception.TranscriptionException}.
 */
public interface TranscriptionService {

    CompletableFuture<TranscriptionStream> open(TranscriptionListener listener);

    /** Provider name for logs. */
    default String name() {
        return getClass().getSimpleName();
    }

    /** False for the placeholder used when no provider is wired in. */
    default boolean isConfigured() {
        return true;
    }
}
