package com.phillippitts.graphicrecorder.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A compacted summary of the analyses in {@code (previous endTime, endTime]} for one meeting.
 * Append-only and never mutated.
 */
public record MetaSummary(
        long id,
        String meetingId,
        long startTime,
        long endTime,
        List<String> summary,
        List<String> themes,
        Long representativeImageId,
        long createdAt
) {
    public MetaSummary {
        Objects.requireNonNull(meetingId, "meetingId");
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime must not precede startTime");
        }
        summary = List.copyOf(summary);
        // themes may come straight from a provider and contain nulls
        themes = themes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(themes));
    }
}
