package com.phillippitts.graphicrecorder.service.session;

import com.phillippitts.graphicrecorder.domain.MeetingMode;
import com.phillippitts.graphicrecorder.protocol.ClientConnection;
import com.phillippitts.graphicrecorder.protocol.ServerMessage;
import com.phillippitts.graphicrecorder.service.audio.PendingAudioBuffer;
import com.phillippitts.graphicrecorder.service.audio.PendingAudioLimits;
import com.phillippitts.graphicrecorder.service.meeting.ImageModelPreset;
import com.phillippitts.graphicrecorder.service.provider.TranscriptionStream;
import com.phillippitts.graphicrecorder.service.timer.TimerHandle;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Everything one client connection owns on the server.
 *
 * <p>Mutable fields are touched only by tasks running on {@link #executor()}, the
 * connection's serial executor; asynchronous completions (transcription events, provider
 * results) are re-posted there first. {@code meetingId} is volatile because the logging
 * wrapper and the viewer registry read it from other threads.
 */
public final class ConnectionContext {

    private final String connectionId;
    private final String sessionId;
    private final String userId;
    private final ClientConnection connection;
    private final Executor executor;
    private final PendingAudioLimits audioLimits;

    private volatile String meetingId;
    private MeetingMode mode;
    private ImageModelPreset imagePreset = ImageModelPreset.FLASH;

    private SessionState session;
    private TranscriptionStream transcription;
    private long startAttempt;
    private boolean transcriptionOpening;
    private PendingAudioBuffer pendingAudio;
    private int pendingUtteranceEnds;
    private TimerHandle analysisTimer = TimerHandle.NONE;
    private AnalysisCoordinator analysis;

    private volatile boolean closed;
    private volatile boolean superseded;

    public ConnectionContext(String connectionId, String sessionId, String userId, ClientConnection connection,
                             Executor executor, PendingAudioLimits audioLimits) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.userId = userId;
        this.connection = Objects.requireNonNull(connection, "connection");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.audioLimits = Objects.requireNonNull(audioLimits, "audioLimits");
        this.pendingAudio = new PendingAudioBuffer(audioLimits);
    }

    public void send(ServerMessage message) {
        connection.send(message);
    }

    /** Runs {@code task} on this connection's serial executor unless the connection closed. */
    public void post(Runnable task) {
        executor.execute(() -> {
            if (!closed) {
                task.run();
            }
        });
    }

    /** Discards the current pending-audio buffer and starts an empty one. */
    public void resetPendingAudio() {
        pendingAudio.clear();
        pendingAudio = new PendingAudioBuffer(audioLimits);
    }

    /** Invalidates any transcription open still in flight; returns the new attempt id. */
    public long nextStartAttempt() {
        return ++startAttempt;
    }

    public boolean isCurrentStartAttempt(long attempt) {
        return attempt == startAttempt && !closed;
    }

    public boolean isRecording() {
        return session != null && session.isRecording();
    }

    public boolean hasMeeting() {
        return meetingId != null;
    }

    public boolean isRecordMode() {
        return meetingId != null && mode == MeetingMode.RECORD;
    }

    public String connectionId() {
        return connectionId;
    }

    public String sessionId() {
        return sessionId;
    }

    public String userId() {
        return userId;
    }

    public ClientConnection connection() {
        return connection;
    }

    public Executor executor() {
        return executor;
    }

    public String meetingId() {
        return meetingId;
    }

    public void setMeetingId(String meetingId) {
        this.meetingId = meetingId;
    }

    public MeetingMode mode() {
        return mode;
    }

    public void setMode(MeetingMode mode) {
        this.mode = mode;
    }

    public ImageModelPreset imagePreset() {
        return imagePreset;
    }

    public void setImagePreset(ImageModelPreset imagePreset) {
        this.imagePreset = imagePreset;
    }

    public SessionState session() {
        return session;
    }

    public void setSession(SessionState session) {
        this.session = session;
    }

    public TranscriptionStream transcription() {
        return transcription;
    }

    public void setTranscription(TranscriptionStream transcription) {
        this.transcription = transcription;
    }

    public boolean isTranscriptionOpening() {
        return transcriptionOpening;
    }

    public void setTranscriptionOpening(boolean transcriptionOpening) {
        this.transcriptionOpening = transcriptionOpening;
    }

    public PendingAudioBuffer pendingAudio() {
        return pendingAudio;
    }

    public int pendingUtteranceEnds() {
        return pendingUtteranceEnds;
    }

    public void setPendingUtteranceEnds(int pendingUtteranceEnds) {
        this.pendingUtteranceEnds = pendingUtteranceEnds;
    }

    public TimerHandle analysisTimer() {
        return analysisTimer;
    }

    public void setAnalysisTimer(TimerHandle analysisTimer) {
        this.analysisTimer = analysisTimer == null ? TimerHandle.NONE : analysisTimer;
    }

    public AnalysisCoordinator analysis() {
        return analysis;
    }

    public void setAnalysis(AnalysisCoordinator analysis) {
        this.analysis = analysis;
    }

    public boolean isClosed() {
        return closed;
    }

    public void markClosed() {
        this.closed = true;
    }

    /** True once a newer connection took over this connection's session id. */
    public boolean isSuperseded() {
        return superseded;
    }

    public void markSuperseded() {
        this.superseded = true;
    }
}
