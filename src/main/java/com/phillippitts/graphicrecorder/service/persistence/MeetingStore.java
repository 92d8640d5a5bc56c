package com.phillippitts.graphicrecorder.service.persistence;

import com.phillippitts.graphicrecorder.domain.AnalysisRecord;
import com.phillippitts.graphicrecorder.domain.AudioRecord;
import com.phillippitts.graphicrecorder.domain.AnalysisResult;
import com.phillippitts.graphicrecorder.domain.CameraFrame;
import com.phillippitts.graphicrecorder.domain.CaptureRecord;
import com.phillippitts.graphicrecorder.domain.GeneratedImage;
import com.phillippitts.graphicrecorder.domain.ImageRecord;
import com.phillippitts.graphicrecorder.domain.Meeting;
import com.phillippitts.graphicrecorder.domain.MetaSummary;
import com.phillippitts.graphicrecorder.domain.SessionRecord;
import com.phillippitts.graphicrecorder.domain.SpeakerAlias;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.exception.StorageException;

import java.util.List;
import java.util.Optional;

/**
 * CRUD persistence for meetings and everything recorded in them.
 *
 * <p>All list queries return records in ascending time order. The {@code loadRecent*}
 * queries are bounded at the storage level (the equivalent of {@code ORDER BY ts DESC
 * LIMIT n}, re-sorted ascending), so building an analysis context never reads the full
 * history of a long meeting.
 *
 * <p>Failures surface as {@link StorageException}.
 */
public interface MeetingStore {

    // --- meetings ---

    Meeting createMeeting(String title, String ownerUserId);

    Optional<Meeting> findMeeting(String meetingId);

    /** Most recently started meetings first. */
    List<Meeting> listMeetings(int limit);

    Meeting updateMeetingTitle(String meetingId, String title);

    void endMeeting(String meetingId);

    // --- sessions ---

    /** Creates the session or resets an existing one with the same id to {@code idle}. */
    SessionRecord upsertSession(String meetingId, String sessionId);

    void startSession(String sessionId);

    void stopSession(String sessionId);

    Optional<SessionRecord> findSession(String sessionId);

    List<SessionRecord> loadMeetingSessions(String meetingId);

    // --- transcripts ---

    void persistTranscript(String sessionId, TranscriptSegment segment);

    /**
     * Flags the newest final segment of the session that is not yet flagged.
     *
     * @return false when there is no such segment yet
     */
    boolean markUtteranceEnd(String sessionId);

    List<TranscriptSegment> loadMeetingTranscript(String meetingId);

    // --- analyses ---

    AnalysisRecord persistAnalysis(String sessionId, AnalysisResult result, long timestamp);

    List<AnalysisRecord> loadMeetingAnalyses(String meetingId);

    List<AnalysisRecord> loadRecentMeetingAnalyses(String meetingId, int limit);

    /** Analyses with {@code timestamp > afterExclusive}, or all when {@code afterExclusive} is null. */
    List<AnalysisRecord> loadMeetingAnalysesAfter(String meetingId, Long afterExclusive);

    // --- images and captures ---

    ImageRecord persistImage(String sessionId, GeneratedImage image);

    List<ImageRecord> loadMeetingImages(String meetingId);

    List<ImageRecord> loadRecentMeetingImages(String meetingId, int limit);

    Optional<ImageRecord> findImage(long imageId);

    CaptureRecord persistCapture(String sessionId, CameraFrame frame);

    List<CaptureRecord> loadMeetingCaptures(String meetingId);

    Optional<CaptureRecord> findCapture(long captureId);

    /** Loads a stored media payload as base64. */
    String loadMediaBase64(String storageKey);

    // --- audio recordings ---

    AudioRecord persistAudio(String sessionId, byte[] audio);

    List<AudioRecord> loadMeetingAudio(String meetingId);

    Optional<AudioRecord> findAudio(long audioId);

    byte[] loadAudio(String storageKey);

    // --- meta-summaries ---

    /**
     * Appends a meta-summary. Rejects one whose {@code startTime} does not lie after the
     * previous one's {@code endTime}.
     */
    MetaSummary persistMetaSummary(String meetingId, long startTime, long endTime,
                                   List<String> summary, List<String> themes, Long representativeImageId);

    List<MetaSummary> loadMetaSummaries(String meetingId);

    Optional<MetaSummary> findLatestMetaSummary(String meetingId);

    // --- speaker aliases ---

    SpeakerAlias upsertSpeakerAlias(String meetingId, int speaker, String displayName);

    void deleteSpeakerAlias(String meetingId, int speaker);

    List<SpeakerAlias> loadSpeakerAliases(String meetingId);

    /** Resolves the meeting a session belongs to. */
    default String meetingOf(String sessionId) {
        return findSession(sessionId)
                .map(SessionRecord::meetingId)
                .orElseThrow(() -> new StorageException("meetingOf", "Unknown session " + sessionId));
    }
}
