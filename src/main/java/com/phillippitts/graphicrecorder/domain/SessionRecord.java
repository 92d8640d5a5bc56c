package com.phillippitts.graphicrecorder.domain;

import java.util.Objects;

/** Persisted view of one recording session within a meeting. */
public record SessionRecord(
        String id,
        String meetingId,
        SessionStatus status,
        Long startedAt,
        Long endedAt
) {
    public SessionRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(meetingId, "meetingId");
        Objects.requireNonNull(status, "status");
    }
}
