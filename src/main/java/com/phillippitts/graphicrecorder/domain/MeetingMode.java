package com.phillippitts.graphicrecorder.domain;

import java.util.Optional;

/**
 * How a connection participates in a meeting: {@code record} may stream audio and
 * edit the meeting, {@code view} only receives.
 */
public enum MeetingMode {
    RECORD("record"),
    VIEW("view");

    private final String wire;

    MeetingMode(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<MeetingMode> fromWire(String value) {
        for (MeetingMode mode : values()) {
            if (mode.wire.equals(value)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    /**
     * Explicit mode wins; otherwise joining an existing meeting opens read-only and a
     * freshly created meeting opens for recording.
     */
    public static MeetingMode resolve(MeetingMode requested, boolean existingMeeting) {
        if (requested != null) {
            return requested;
        }
        return existingMeeting ? VIEW : RECORD;
    }
}
