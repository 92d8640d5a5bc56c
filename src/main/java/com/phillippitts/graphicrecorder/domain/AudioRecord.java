package com.phillippitts.graphicrecorder.domain;

/**
 * Metadata of an uploaded session recording. The audio bytes live under {@code storageKey}.
 */
public record AudioRecord(long id, String sessionId, String meetingId, long sizeBytes, long createdAt,
                          String storageKey) {
}
