package com.phillippitts.graphicrecorder.client.recording;

import com.phillippitts.graphicrecorder.client.ConnectionLifecycle;

import java.util.Objects;

/**
 * Side effects of the {@link RecordingReadiness} saga.
 */
public interface RecordingCallbacks {

    void onSessionStart();

    void onSessionStop();

    default void onChunk(byte[] chunk) {
    }

    default void onStateChanged(ReadinessState state, String error) {
    }

    /**
     * Session start and stop become {@code session:start} and {@code session:stop} on the
     * given lifecycle; chunks go out as binary frames.
     */
    static RecordingCallbacks forConnection(ConnectionLifecycle lifecycle) {
        Objects.requireNonNull(lifecycle, "lifecycle");
        return new RecordingCallbacks() {
            @Override
            public void onSessionStart() {
                lifecycle.startSession();
            }

            @Override
            public void onSessionStop() {
                lifecycle.stopSession();
            }

            @Override
            public void onChunk(byte[] chunk) {
                lifecycle.sendAudio(chunk);
            }
        };
    }
}
