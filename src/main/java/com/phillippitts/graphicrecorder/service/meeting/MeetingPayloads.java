package com.phillippitts.graphicrecorder.service.meeting;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.graphicrecorder.domain.MeetingMode;

import java.util.Optional;

/**
 * Readers for the {@code data} object of meeting-related client messages.
 *
 * <p>Each reader returns empty (or null) for a malformed payload and leaves the choice of
 * error code to the caller, so validation order stays in the use case.
 */
final class MeetingPayloads {

    private MeetingPayloads() {}

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    /** Text value of {@code field}, or null when absent or not a string. */
    static String readText(JsonNode data, String field) {
        if (isAbsent(data) || !data.isObject()) {
            return null;
        }
        JsonNode value = data.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /**
     * {@code meeting:start} payload. A missing {@code data} means "create an untitled
     * meeting"; present fields must have the right type.
     */
    static Optional<MeetingStartRequest> readStart(JsonNode data) {
        if (isAbsent(data)) {
            return Optional.of(new MeetingStartRequest(null, null, null));
        }
        if (!data.isObject()) {
            return Optional.empty();
        }
        JsonNode title = data.get("title");
        JsonNode meetingId = data.get("meetingId");
        JsonNode mode = data.get("mode");
        if (!isAbsent(title) && !title.isTextual()) {
            return Optional.empty();
        }
        if (!isAbsent(meetingId) && !meetingId.isTextual()) {
            return Optional.empty();
        }
        MeetingMode requestedMode = null;
        if (!isAbsent(mode)) {
            if (!mode.isTextual()) {
                return Optional.empty();
            }
            Optional<MeetingMode> parsed = MeetingMode.fromWire(mode.asText());
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            requestedMode = parsed.get();
        }
        return Optional.of(new MeetingStartRequest(
                isAbsent(title) ? null : title.asText(),
                isAbsent(meetingId) ? null : meetingId.asText(),
                requestedMode));
    }

    static Optional<MeetingMode> readMode(JsonNode data) {
        return MeetingMode.fromWire(readText(data, "mode"));
    }

    /** Non-negative integral speaker index; numeric strings are accepted. */
    static Optional<Integer> readSpeaker(JsonNode data) {
        if (isAbsent(data) || !data.isObject()) {
            return Optional.empty();
        }
        JsonNode speaker = data.get("speaker");
        if (isAbsent(speaker)) {
            return Optional.empty();
        }
        double value;
        if (speaker.isNumber()) {
            value = speaker.asDouble();
        } else if (speaker.isTextual()) {
            try {
                value = Double.parseDouble(speaker.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        if (Double.isNaN(value) || value < 0 || value > Integer.MAX_VALUE || value != Math.floor(value)) {
            return Optional.empty();
        }
        return Optional.of((int) value);
    }

    /**
     * {@code meeting:history:request} payload. Cursor fields must be finite numbers when
     * present.
     */
    static Optional<HistoryRequest> readHistoryRequest(JsonNode data) {
        if (isAbsent(data) || !data.isObject()) {
            return Optional.empty();
        }
        JsonNode meetingId = data.get("meetingId");
        if (meetingId == null || !meetingId.isTextual()) {
            return Optional.empty();
        }
        JsonNode cursorNode = data.get("cursor");
        if (isAbsent(cursorNode)) {
            return Optional.of(new HistoryRequest(meetingId.asText(), HistoryCursor.EMPTY));
        }
        if (!cursorNode.isObject()) {
            return Optional.empty();
        }
        Long[] values = new Long[HistoryCursor.FIELDS.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = cursorNode.get(HistoryCursor.FIELDS.get(i));
            if (isAbsent(value)) {
                continue;
            }
            if (!value.isNumber() || !Double.isFinite(value.asDouble())) {
                return Optional.empty();
            }
            values[i] = (long) Math.floor(value.asDouble());
        }
        return Optional.of(new HistoryRequest(meetingId.asText(),
                new HistoryCursor(values[0], values[1], values[2], values[3], values[4])));
    }
}
