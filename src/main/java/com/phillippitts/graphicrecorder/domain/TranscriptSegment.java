package com.phillippitts.graphicrecorder.domain;

import java.util.Objects;

/**
 * One transcript fragment from the speech provider.
 *
 * @param text          recognized text
 * @param timestamp     epoch millis when the fragment was received
 * @param isFinal       false for interim hypotheses that will be replaced
 * @param speaker       diarization index, or null
 * @param startTime     offset in seconds of the utterance start within the audio, or null
 * @param utteranceEnd  set retroactively when the provider signals a pause after this fragment
 */
public record TranscriptSegment(
        String text,
        long timestamp,
        boolean isFinal,
        Integer speaker,
        Double startTime,
        boolean utteranceEnd
) {
    public TranscriptSegment {
        Objects.requireNonNull(text, "text");
    }

    public TranscriptSegment withUtteranceEnd() {
        return new TranscriptSegment(text, timestamp, isFinal, speaker, startTime, true);
    }
}
