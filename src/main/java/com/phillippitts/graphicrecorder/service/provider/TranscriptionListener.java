package com.phillippitts.graphicrecorder.service.provider;

import com.phillippitts.graphicrecorder.domain.SttState;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;

/**
 * Events from an open transcription leg. Implementations are invoked on provider threads
 * and must hand work back to their own executor.
 */
public interface TranscriptionListener {

    void onTranscript(TranscriptSegment segment);

    /** The provider detected a pause; applies to the most recent final segment. */
    void onUtteranceEnd(long timestamp);

    /**
     * Connection state of the leg changed.
     *
     * @param retryAttempt reconnect attempt number while reconnecting, otherwise null
     * @param message      optional human-readable detail
     */
    void onStatus(SttState state, Integer retryAttempt, String message);

    void onError(Throwable error);

    void onClose();
}
