package com.phillippitts.graphicrecorder.domain;

/** Metadata of a persisted generated image; the payload lives under {@code storageKey}. */
public record ImageRecord(long id, String sessionId, String prompt, long timestamp, String storageKey) {
}
