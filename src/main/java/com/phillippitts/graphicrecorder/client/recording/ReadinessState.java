package com.phillippitts.graphicrecorder.client.recording;

/** Where a {@link RecordingReadiness} saga stands. */
public enum ReadinessState {
    IDLE,
    /** Start was requested while disconnected; waits for the channel. */
    PENDING_START,
    RECORDING
}
