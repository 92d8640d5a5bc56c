package com.phillippitts.graphicrecorder.domain;

import java.util.Objects;

/** Display name for a diarized speaker index within a meeting. */
public record SpeakerAlias(String meetingId, int speaker, String displayName, long updatedAt) {
    public SpeakerAlias {
        Objects.requireNonNull(meetingId, "meetingId");
        Objects.requireNonNull(displayName, "displayName");
        if (speaker < 0) {
            throw new IllegalArgumentException("speaker must be >= 0");
        }
    }
}
