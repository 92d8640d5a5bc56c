package com.phillippitts.graphicrecorder.service.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.graphicrecorder.config.properties.AnalysisProperties;
import com.phillippitts.graphicrecorder.domain.CameraFrame;
import com.phillippitts.graphicrecorder.domain.SessionStatus;
import com.phillippitts.graphicrecorder.domain.SttState;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.protocol.ServerMessages;
import com.phillippitts.graphicrecorder.service.audio.Admission;
import com.phillippitts.graphicrecorder.service.audio.PendingAudioBuffer;
import com.phillippitts.graphicrecorder.service.events.AudioChunkDroppedEvent;
import com.phillippitts.graphicrecorder.service.events.RecordingLockConflictEvent;
import com.phillippitts.graphicrecorder.service.lock.RecordingLockManager;
import com.phillippitts.graphicrecorder.service.persistence.MeetingStore;
import com.phillippitts.graphicrecorder.service.persistence.PersistenceWriter;
import com.phillippitts.graphicrecorder.service.provider.Providers;
import com.phillippitts.graphicrecorder.service.provider.TranscriptionListener;
import com.phillippitts.graphicrecorder.service.provider.TranscriptionStream;
import com.phillippitts.graphicrecorder.service.timer.TimerHandle;
import com.phillippitts.graphicrecorder.service.timer.Timers;
import com.phillippitts.graphicrecorder.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Starts and stops recording sessions and routes what flows through them.
 *
 * <p>All entry points run on the connection's serial executor. Transcription events and
 * the open completion are re-posted there, tagged with the start attempt that produced
 * them; a stop or a newer start bumps the attempt, so anything from an older leg is
 * dropped (and a late-opening leg is closed).
 *
 * <p>Audio arriving while the leg is not ready goes through the pending-audio guard and is
 * flushed in arrival order once the leg opens.
 */
@Service
public class SessionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(SessionOrchestrator.class);

    private final Providers providers;
    private final RecordingLockManager locks;
    private final MeetingStore store;
    private final PersistenceWriter writer;
    private final MeetingConnections connections;
    private final AnalysisCoordinators coordinators;
    private final AnalysisProperties properties;
    private final Timers timers;
    private final Clock clock;
    private final ApplicationEventPublisher events;

    public SessionOrchestrator(Providers providers,
                               RecordingLockManager locks,
                               MeetingStore store,
                               PersistenceWriter writer,
                               MeetingConnections connections,
                               AnalysisCoordinators coordinators,
                               AnalysisProperties properties,
                               Timers timers,
                               Clock clock,
                               ApplicationEventPublisher events) {
        this.providers = providers;
        this.locks = locks;
        this.store = store;
        this.writer = writer;
        this.connections = connections;
        this.coordinators = coordinators;
        this.properties = properties;
        this.timers = timers;
        this.clock = clock;
        this.events = events;
    }

    /**
     * Handles {@code session:start}: takes the meeting's recording lock and opens the
     * transcription leg. {@code session:status{recording}} follows once the leg is ready.
     *
     * @throws DomainException without a meeting, in view mode, or when another session
     *                         holds the lock
     */
    public void start(ConnectionContext ctx) {
        if (!ctx.hasMeeting()) {
            throw new DomainException(ErrorCode.NO_ACTIVE_MEETING, "No active meeting");
        }
        if (!ctx.isRecordMode()) {
            throw new DomainException(ErrorCode.READ_ONLY_MEETING, "This meeting is in read-only mode");
        }
        if (ctx.isRecording()) {
            ctx.send(ServerMessages.sessionStatus(SessionStatus.RECORDING, null));
            return;
        }
        if (ctx.isTranscriptionOpening()) {
            LOG.debug("session:start ignored; transcription leg already opening");
            return;
        }

        String meetingId = ctx.meetingId();
        if (!locks.acquire(meetingId, ctx.sessionId())) {
            events.publishEvent(new RecordingLockConflictEvent(meetingId, ctx.sessionId(),
                    locks.holderOf(meetingId).orElse(null), clock.instant()));
            throw new DomainException(ErrorCode.MEETING_ALREADY_RECORDING,
                    "Another user is already recording this meeting");
        }

        long attempt = ctx.nextStartAttempt();
        ctx.setTranscriptionOpening(true);
        LOG.info("Opening transcription leg (provider={})", providers.transcription().name());

        CompletableFuture<TranscriptionStream> opening;
        try {
            opening = providers.transcription().open(new SessionListener(ctx, attempt));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        // not ctx.post: a late leg must still be closed after the connection closed
        opening.whenComplete((stream, error) ->
                ctx.executor().execute(() -> onTranscriptionOpened(ctx, attempt, meetingId, stream, error)));
    }

    /** Handles {@code session:stop}: tears the session down and releases the lock. */
    public void stop(ConnectionContext ctx) {
        String meetingId = ctx.meetingId();
        cleanup(ctx);
        if (meetingId != null) {
            locks.release(meetingId, ctx.sessionId());
        }
        ctx.send(ServerMessages.sessionStatus(SessionStatus.IDLE, null));
    }

    /**
     * Tears down the session without sending anything or touching the lock: cancels the
     * analysis timer, invalidates any open in flight, closes the leg and discards buffered
     * audio. A superseded connection leaves the stored session to its successor.
     */
    public void cleanup(ConnectionContext ctx) {
        ctx.analysisTimer().cancel();
        ctx.setAnalysisTimer(TimerHandle.NONE);
        ctx.nextStartAttempt();
        ctx.setTranscriptionOpening(false);

        TranscriptionStream stream = ctx.transcription();
        ctx.setTranscription(null);
        if (stream != null) {
            closeLeg(stream);
        }
        AnalysisCoordinator analysis = ctx.analysis();
        ctx.setAnalysis(null);
        if (analysis != null) {
            analysis.dispose();
        }
        ctx.resetPendingAudio();
        ctx.setPendingUtteranceEnds(0);

        SessionState session = ctx.session();
        ctx.setSession(null);
        if (session != null && session.isRecording()) {
            session.stop();
            LOG.info("Recording session stopped");
            if (!ctx.isSuperseded()) {
                String sessionId = ctx.sessionId();
                writer.run("stopSession", () -> store.stopSession(sessionId));
            }
        }
    }

    /** Forwards a binary audio frame, or buffers it while the leg is not ready. */
    public void handleAudioChunk(ConnectionContext ctx, byte[] chunk) {
        TranscriptionStream stream = ctx.transcription();
        if (stream != null && stream.isConnected()) {
            stream.sendAudio(chunk);
            return;
        }
        PendingAudioBuffer buffer = ctx.pendingAudio();
        Admission admission = buffer.offer(chunk);
        if (!admission.canBuffer()) {
            events.publishEvent(new AudioChunkDroppedEvent(ctx.sessionId(), admission.reason(), chunk.length,
                    buffer.chunkCount(), buffer.byteCount(), clock.instant()));
        }
    }

    /** Handles {@code camera:frame{base64, timestamp}}. Frames outside a recording are ignored. */
    public void handleCameraFrame(ConnectionContext ctx, JsonNode data) {
        CameraFrame frame = readCameraFrame(data);
        SessionState session = ctx.session();
        if (session == null || !session.isRecording()) {
            LOG.debug("Camera frame ignored; no active recording");
            return;
        }
        session.addCameraFrame(frame);
        String sessionId = ctx.sessionId();
        writer.submit("persistCapture", () -> store.persistCapture(sessionId, frame));
    }

    static CameraFrame readCameraFrame(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw invalidFrame();
        }
        JsonNode base64 = data.get("base64");
        JsonNode timestamp = data.get("timestamp");
        if (base64 == null || !base64.isTextual() || base64.asText().isEmpty()) {
            throw invalidFrame();
        }
        if (timestamp == null || !timestamp.isNumber() || !Double.isFinite(timestamp.asDouble())) {
            throw invalidFrame();
        }
        return new CameraFrame(base64.asText(), timestamp.asLong());
    }

    private static DomainException invalidFrame() {
        return new DomainException(ErrorCode.INVALID_CAMERA_FRAME, "Invalid camera frame payload");
    }

    private void onTranscriptionOpened(ConnectionContext ctx, long attempt, String meetingId,
                                       TranscriptionStream stream, Throwable error) {
        if (!ctx.isCurrentStartAttempt(attempt)) {
            if (stream != null) {
                LOG.info("Closing transcription leg that opened after its session ended");
                closeLeg(stream);
            }
            return;
        }
        ctx.setTranscriptionOpening(false);
        if (error != null) {
            LOG.warn("Failed to open transcription leg: {}", ErrorSanitizer.sanitize(error));
            locks.release(meetingId, ctx.sessionId());
            ctx.resetPendingAudio();
            ctx.send(ServerMessages.sessionStatus(SessionStatus.ERROR, ErrorSanitizer.sanitize(error)));
            return;
        }

        ctx.setTranscription(stream);
        List<byte[]> buffered = ctx.pendingAudio().drain();
        for (byte[] chunk : buffered) {
            stream.sendAudio(chunk);
        }

        long now = clock.millis();
        SessionState session = new SessionState(ctx.sessionId(), properties.getCameraFrameBufferSize());
        session.start(now);
        ctx.setSession(session);
        ctx.setAnalysis(coordinators.create(ctx, session, meetingId));

        String sessionId = ctx.sessionId();
        writer.run("startSession", () -> {
            store.upsertSession(meetingId, sessionId);
            store.startSession(sessionId);
        });
        ctx.setAnalysisTimer(timers.scheduleAtFixedRate(Duration.ofMillis(properties.getCheckIntervalMs()),
                () -> ctx.post(() -> {
                    AnalysisCoordinator analysis = ctx.analysis();
                    if (analysis != null) {
                        analysis.checkAndRun();
                    }
                })));
        LOG.info("Recording session started ({} buffered chunks flushed)", buffered.size());
        ctx.send(ServerMessages.sessionStatus(SessionStatus.RECORDING, null));
    }

    private void onTranscript(ConnectionContext ctx, long attempt, TranscriptSegment segment) {
        SessionState session = ctx.session();
        if (session == null) {
            return;
        }
        session.addTranscript(segment);
        connections.broadcastFrom(ctx, ServerMessages.transcript(segment));
        if (!segment.isFinal()) {
            return;
        }
        String sessionId = ctx.sessionId();
        writer.run("persistTranscript", () -> store.persistTranscript(sessionId, segment))
                .thenRun(() -> ctx.post(() -> applyPendingUtteranceEnd(ctx, attempt)));
        AnalysisCoordinator analysis = ctx.analysis();
        if (analysis != null) {
            analysis.checkAndRun();
        }
    }

    private void onUtteranceEnd(ConnectionContext ctx, long attempt, long timestamp) {
        connections.broadcastFrom(ctx, ServerMessages.utteranceEnd(timestamp));
        String sessionId = ctx.sessionId();
        writer.submit("markUtteranceEnd", () -> store.markUtteranceEnd(sessionId))
                .thenAccept(marked -> {
                    if (!marked.orElse(Boolean.FALSE)) {
                        // no unmarked final segment stored yet; apply after the next one
                        ctx.post(() -> {
                            if (ctx.isCurrentStartAttempt(attempt)) {
                                ctx.setPendingUtteranceEnds(ctx.pendingUtteranceEnds() + 1);
                            }
                        });
                    }
                });
    }

    /** Applies at most one pending utterance end per persisted final segment. */
    private void applyPendingUtteranceEnd(ConnectionContext ctx, long attempt) {
        if (!ctx.isCurrentStartAttempt(attempt) || ctx.pendingUtteranceEnds() == 0) {
            return;
        }
        String sessionId = ctx.sessionId();
        writer.submit("markUtteranceEnd", () -> store.markUtteranceEnd(sessionId))
                .thenAccept(marked -> {
                    if (marked.orElse(Boolean.FALSE)) {
                        ctx.post(() -> {
                            if (ctx.isCurrentStartAttempt(attempt)) {
                                ctx.setPendingUtteranceEnds(Math.max(0, ctx.pendingUtteranceEnds() - 1));
                            }
                        });
                    }
                });
    }

    private static void closeLeg(TranscriptionStream stream) {
        try {
            stream.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing transcription leg: {}", e.getMessage());
        }
    }

    /** Re-posts provider callbacks onto the connection, dropping those of a stale attempt. */
    private final class SessionListener implements TranscriptionListener {

        private final ConnectionContext ctx;
        private final long attempt;

        SessionListener(ConnectionContext ctx, long attempt) {
            this.ctx = ctx;
            this.attempt = attempt;
        }

        @Override
        public void onTranscript(TranscriptSegment segment) {
            onCurrent(() -> SessionOrchestrator.this.onTranscript(ctx, attempt, segment));
        }

        @Override
        public void onUtteranceEnd(long timestamp) {
            onCurrent(() -> SessionOrchestrator.this.onUtteranceEnd(ctx, attempt, timestamp));
        }

        @Override
        public void onStatus(SttState state, Integer retryAttempt, String message) {
            onCurrent(() -> ctx.send(ServerMessages.sttStatus(state, retryAttempt, message)));
        }

        @Override
        public void onError(Throwable error) {
            onCurrent(() -> {
                LOG.warn("Transcription error: {}", ErrorSanitizer.sanitize(error));
                ctx.send(ServerMessages.error(ErrorSanitizer.sanitize(error), null));
            });
        }

        @Override
        public void onClose() {
            onCurrent(() -> LOG.info("Transcription leg closed"));
        }

        private void onCurrent(Runnable task) {
            ctx.post(() -> {
                if (ctx.isCurrentStartAttempt(attempt)) {
                    task.run();
                }
            });
        }
    }
}
