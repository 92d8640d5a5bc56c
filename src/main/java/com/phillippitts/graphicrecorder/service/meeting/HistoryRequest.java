package com.phillippitts.graphicrecorder.service.meeting;

import java.util.Objects;

public record HistoryRequest(String meetingId, HistoryCursor cursor) {

    public HistoryRequest {
        Objects.requireNonNull(meetingId, "meetingId");
        cursor = cursor == null ? HistoryCursor.EMPTY : cursor;
    }
}
