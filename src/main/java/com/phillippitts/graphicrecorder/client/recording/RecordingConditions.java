package com.phillippitts.graphicrecorder.client.recording;

/**
 * Everything recording depends on, as observed by the caller at one instant.
 *
 * @param audioStream acquired microphone stream, or null when none
 */
public record RecordingConditions(boolean hasMeeting, boolean hasPermission, AudioStream audioStream,
                                  boolean isConnected) {

    /** Permission granted and a stream available. */
    public boolean canCapture() {
        return hasPermission && audioStream != null;
    }

    /** Meeting, permission and stream all present; connectivity aside. */
    boolean isViable() {
        return hasMeeting && canCapture();
    }
}
