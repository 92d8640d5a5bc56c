package com.phillippitts.graphicrecorder.service.session;

import com.phillippitts.graphicrecorder.domain.AnalysisResult;
import com.phillippitts.graphicrecorder.domain.CameraFrame;
import com.phillippitts.graphicrecorder.domain.GeneratedImage;
import com.phillippitts.graphicrecorder.domain.SessionStatus;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Live, in-memory state of one recording session.
 *
 * <p>Owned by the connection task; not thread-safe. Only what the analysis trigger and
 * prompt continuity need is kept here: transcript text is dropped once an analysis has
 * consumed it, and camera frames are a fixed-size ring. Full history lives in the store.
 */
public final class SessionState {

    private final String sessionId;
    private final int cameraFrameCapacity;

    private SessionStatus status = SessionStatus.IDLE;
    private long startedAt;
    private final List<TranscriptSegment> pending = new ArrayList<>();
    private long lastAnalysisAt;
    private int wordsSinceLastAnalysis;
    private AnalysisResult lastAnalysis;
    private GeneratedImage lastImage;
    private final ArrayDeque<CameraFrame> cameraFrames = new ArrayDeque<>();

    public SessionState(String sessionId, int cameraFrameCapacity) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        if (cameraFrameCapacity <= 0) {
            throw new IllegalArgumentException("cameraFrameCapacity must be positive");
        }
        this.cameraFrameCapacity = cameraFrameCapacity;
    }

    public void start(long now) {
        status = SessionStatus.RECORDING;
        startedAt = now;
        lastAnalysisAt = now;
    }

    public void stop() {
        status = SessionStatus.IDLE;
    }

    public boolean isRecording() {
        return status == SessionStatus.RECORDING;
    }

    /**
     * Appends a segment. An interim segment replaces a trailing interim one, since the
     * provider re-sends the growing hypothesis until it is final.
     */
    public void addTranscript(TranscriptSegment segment) {
        if (!pending.isEmpty() && !pending.get(pending.size() - 1).isFinal()) {
            pending.remove(pending.size() - 1);
        }
        pending.add(segment);
        if (segment.isFinal()) {
            wordsSinceLastAnalysis += countWords(segment.text());
        }
    }

    /** Final text received since the previous analysis, space-joined. */
    public String transcriptSinceLastAnalysis() {
        return pending.stream()
                .filter(TranscriptSegment::isFinal)
                .map(TranscriptSegment::text)
                .collect(Collectors.joining(" "))
                .trim();
    }

    /**
     * True when recording, new final text exists, and either the interval elapsed or enough
     * words accumulated.
     */
    public boolean shouldTriggerAnalysis(long now, long intervalMs, int wordThreshold) {
        if (!isRecording() || transcriptSinceLastAnalysis().isEmpty()) {
            return false;
        }
        return now - lastAnalysisAt >= intervalMs || wordsSinceLastAnalysis >= wordThreshold;
    }

    /**
     * Marks the text consumed by an analysis started at {@code now}. Called when the
     * analysis starts so text arriving meanwhile counts towards the next one.
     */
    public void markAnalysisStarted(long now) {
        TranscriptSegment trailing = pending.isEmpty() ? null : pending.get(pending.size() - 1);
        pending.clear();
        // an interim hypothesis was not part of the analysis
        if (trailing != null && !trailing.isFinal()) {
            pending.add(trailing);
        }
        lastAnalysisAt = now;
        wordsSinceLastAnalysis = 0;
    }

    public void recordAnalysis(AnalysisResult result) {
        lastAnalysis = result;
    }

    public void recordImage(GeneratedImage image) {
        lastImage = image;
    }

    /** Keeps only the most recent frames, evicting the oldest. */
    public void addCameraFrame(CameraFrame frame) {
        if (cameraFrames.size() == cameraFrameCapacity) {
            cameraFrames.pollFirst();
        }
        cameraFrames.addLast(frame);
    }

    public List<CameraFrame> cameraFrames() {
        return List.copyOf(cameraFrames);
    }

    public List<String> previousTopics() {
        return lastAnalysis == null ? List.of() : lastAnalysis.topics();
    }

    public GeneratedImage lastImage() {
        return lastImage;
    }

    /** Segments not yet consumed by an analysis. */
    public List<TranscriptSegment> pendingTranscript() {
        return List.copyOf(pending);
    }

    public String sessionId() {
        return sessionId;
    }

    public SessionStatus status() {
        return status;
    }

    public long startedAt() {
        return startedAt;
    }

    public int wordsSinceLastAnalysis() {
        return wordsSinceLastAnalysis;
    }

    static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
