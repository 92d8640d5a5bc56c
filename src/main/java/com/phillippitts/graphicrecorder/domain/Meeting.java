package com.phillippitts.graphicrecorder.domain;

import java.util.Objects;

/**
 * A persistent meeting. Title and owner are optional; {@code endedAt} is null until the
 * meeting is stopped.
 */
public record Meeting(
        String id,
        String title,
        String ownerUserId,
        long startedAt,
        Long endedAt,
        long createdAt
) {
    public Meeting {
        Objects.requireNonNull(id, "id");
    }

    public Meeting withTitle(String newTitle) {
        return new Meeting(id, newTitle, ownerUserId, startedAt, endedAt, createdAt);
    }

    public Meeting endedAt(long when) {
        return new Meeting(id, title, ownerUserId, startedAt, when, createdAt);
    }
}
