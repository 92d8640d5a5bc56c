package com.phillippitts.graphicrecorder.domain;

/** Metadata of a persisted camera capture. */
public record CaptureRecord(long id, String sessionId, long timestamp, String storageKey) {
}
