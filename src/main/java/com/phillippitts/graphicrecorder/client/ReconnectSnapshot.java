package com.phillippitts.graphicrecorder.client;

import com.phillippitts.graphicrecorder.domain.MeetingMode;

import java.util.Objects;

/**
 * Meeting context captured when a channel is lost, replayed after the next open.
 */
public record ReconnectSnapshot(String meetingId, MeetingMode mode, boolean wasRecording) {

    public ReconnectSnapshot {
        Objects.requireNonNull(meetingId, "meetingId");
    }

    ReconnectSnapshot withoutRecording() {
        return new ReconnectSnapshot(meetingId, mode, false);
    }
}
