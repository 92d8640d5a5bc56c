package com.phillippitts.graphicrecorder.domain;

import java.util.Objects;

/** An analysis persisted against a session, append-only. */
public record AnalysisRecord(long id, String sessionId, AnalysisResult result, long timestamp) {
    public AnalysisRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(result, "result");
    }
}
