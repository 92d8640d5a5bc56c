package com.phillippitts.graphicrecorder.client;

import com.phillippitts.graphicrecorder.domain.MeetingMode;

/**
 * Immutable view of a {@link ConnectionLifecycle}, published after every transition.
 *
 * @param error       last transport error, cleared on open; null when none
 * @param meetingId   meeting the server last confirmed, or null
 * @param recording   whether the server last reported a recording session
 */
public record ConnectionState(
        ConnectionPhase phase,
        int reconnectAttempt,
        String error,
        String meetingId,
        MeetingMode mode,
        boolean recording
) {
    static final ConnectionState INITIAL =
            new ConnectionState(ConnectionPhase.DISCONNECTED, 0, null, null, null, false);

    public boolean isConnected() {
        return phase == ConnectionPhase.CONNECTED;
    }
}
