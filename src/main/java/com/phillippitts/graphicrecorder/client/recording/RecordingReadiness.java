package com.phillippitts.graphicrecorder.client.recording;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Starts and stops local audio capture as meeting, permission, stream and connectivity
 * come and go, and tells the server about it.
 *
 * <p>{@code onSessionStop} is emitted only after an {@code onSessionStart} of the same
 * attempt, and exactly once. Recorder callbacks of an earlier attempt are ignored.
 *
 * <p>Thread-safe; callbacks are invoked while holding this saga's monitor and must not
 * block.
 */
public final class RecordingReadiness {

    private static final Logger LOG = LogManager.getLogger(RecordingReadiness.class);

    static final String UNAVAILABLE = "Microphone permission or audio stream unavailable";
    static final String START_FAILED = "Failed to start recording";
    static final String RECORDING_ERROR = "Recording error occurred";

    private final AudioRecorderFactory recorders;
    private final RecordingCallbacks callbacks;

    private ReadinessState state = ReadinessState.IDLE;
    private String error;
    private AudioRecorder recorder;
    private long attempt;
    private boolean didEmitSessionStart;
    private boolean disposed;

    public RecordingReadiness(AudioRecorderFactory recorders, RecordingCallbacks callbacks) {
        this.recorders = Objects.requireNonNull(recorders, "recorders");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
    }

    public synchronized ReadinessState state() {
        return state;
    }

    /** Last error, or null. */
    public synchronized String error() {
        return error;
    }

    public synchronized void start(RecordingConditions conditions) {
        if (disposed || state != ReadinessState.IDLE) {
            return;
        }
        if (!conditions.hasMeeting()) {
            return;
        }
        if (!conditions.canCapture()) {
            error = UNAVAILABLE;
            notifyState();
            return;
        }
        error = null;
        if (!conditions.isConnected()) {
            state = ReadinessState.PENDING_START;
            LOG.debug("Recording pending until connected");
            notifyState();
            return;
        }
        beginRecording(conditions);
    }

    public synchronized void onConditionsChanged(RecordingConditions conditions) {
        if (disposed) {
            return;
        }
        if (state == ReadinessState.PENDING_START) {
            if (!conditions.isViable()) {
                LOG.debug("Pending recording cancelled; conditions lost");
                state = ReadinessState.IDLE;
                notifyState();
            } else if (conditions.isConnected()) {
                beginRecording(conditions);
            }
        } else if (state == ReadinessState.RECORDING && !conditions.isViable()) {
            LOG.info("Stopping recording; meeting, permission or stream lost");
            stopRecording(null);
        }
    }

    public synchronized void stop() {
        if (state == ReadinessState.PENDING_START) {
            state = ReadinessState.IDLE;
            notifyState();
        } else if (state == ReadinessState.RECORDING) {
            stopRecording(null);
        }
    }

    public synchronized void dispose() {
        stop();
        disposed = true;
    }

    private void beginRecording(RecordingConditions conditions) {
        long current = ++attempt;
        AudioRecorder created = null;
        try {
            created = recorders.create(conditions.audioStream(),
                    chunk -> onChunk(current, chunk),
                    failure -> onRecorderError(current, failure));
            created.start();
        } catch (RuntimeException e) {
            LOG.warn("Recorder failed to start on {}: {}", conditions.audioStream().deviceId(), e.getMessage());
            if (created != null) {
                stopQuietly(created);
            }
            state = ReadinessState.IDLE;
            error = START_FAILED;
            notifyState();
            return;
        }
        recorder = created;
        state = ReadinessState.RECORDING;
        didEmitSessionStart = true;
        LOG.info("Recording started on {}", conditions.audioStream().deviceId());
        callbacks.onSessionStart();
        notifyState();
    }

    private void stopRecording(String failure) {
        AudioRecorder active = recorder;
        recorder = null;
        attempt++;
        if (active != null) {
            stopQuietly(active);
        }
        state = ReadinessState.IDLE;
        if (failure != null) {
            error = failure;
        }
        if (didEmitSessionStart) {
            didEmitSessionStart = false;
            callbacks.onSessionStop();
        }
        notifyState();
    }

    private synchronized void onChunk(long from, byte[] chunk) {
        if (from != attempt || state != ReadinessState.RECORDING || disposed) {
            return;
        }
        callbacks.onChunk(chunk);
    }

    private synchronized void onRecorderError(long from, Throwable failure) {
        if (from != attempt || state != ReadinessState.RECORDING) {
            return;
        }
        LOG.warn("Recorder failed: {}", failure == null ? "unknown" : failure.getMessage());
        stopRecording(RECORDING_ERROR);
    }

    private void notifyState() {
        if (disposed) {
            return;
        }
        callbacks.onStateChanged(state, error);
    }

    private static void stopQuietly(AudioRecorder recorder) {
        try {
            recorder.stop();
        } catch (RuntimeException e) {
            LOG.warn("Recorder failed to stop: {}", e.getMessage());
        }
    }
}
