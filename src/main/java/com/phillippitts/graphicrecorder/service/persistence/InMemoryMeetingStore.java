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
import com.phillippitts.graphicrecorder.domain.SessionStatus;
import com.phillippitts.graphicrecorder.domain.SpeakerAlias;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.exception.StorageException;
import com.phillippitts.graphicrecorder.util.Ids;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Process-local {@link MeetingStore}.
 *
 * <p>Every method is {@code synchronized}: writes arrive serialized from
 * {@link PersistenceWriter}, while reads come from connection tasks and REST requests.
 * Records remember the meeting their session belonged to when they were written, so a
 * session id reused for another meeting does not drag its history along.
 */
@Repository
public class InMemoryMeetingStore implements MeetingStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryMeetingStore.class);

    private final Clock clock;

    private final Map<String, Meeting> meetings = new LinkedHashMap<>();
    private final Map<String, SessionRecord> sessions = new HashMap<>();
    private final Map<String, List<Owned<TranscriptSegment>>> transcriptsBySession = new HashMap<>();
    private final List<Owned<AnalysisRecord>> analyses = new ArrayList<>();
    private final List<Owned<ImageRecord>> images = new ArrayList<>();
    private final List<Owned<CaptureRecord>> captures = new ArrayList<>();
    private final Map<String, String> media = new HashMap<>();
    private final List<AudioRecord> audioRecords = new ArrayList<>();
    private final Map<String, byte[]> audio = new HashMap<>();
    private final Map<String, List<MetaSummary>> metaSummaries = new HashMap<>();
    private final Map<String, TreeMap<Integer, SpeakerAlias>> aliases = new HashMap<>();

    private long nextId = 1;

    public InMemoryMeetingStore(Clock clock) {
        this.clock = clock;
    }

    // --- meetings ---

    @Override
    public synchronized Meeting createMeeting(String title, String ownerUserId) {
        long now = clock.millis();
        Meeting meeting = new Meeting(Ids.newMeetingId(), title, ownerUserId, now, null, now);
        meetings.put(meeting.id(), meeting);
        LOG.debug("Meeting created (meeting={})", meeting.id());
        return meeting;
    }

    @Override
    public synchronized Optional<Meeting> findMeeting(String meetingId) {
        return Optional.ofNullable(meetings.get(meetingId));
    }

    @Override
    public synchronized List<Meeting> listMeetings(int limit) {
        return meetings.values().stream()
                .sorted(Comparator.comparingLong(Meeting::startedAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public synchronized Meeting updateMeetingTitle(String meetingId, String title) {
        Meeting updated = requireMeeting(meetingId, "updateMeetingTitle").withTitle(title);
        meetings.put(meetingId, updated);
        return updated;
    }

    @Override
    public synchronized void endMeeting(String meetingId) {
        Meeting meeting = requireMeeting(meetingId, "endMeeting");
        if (meeting.endedAt() == null) {
            meetings.put(meetingId, meeting.endedAt(clock.millis()));
        }
    }

    // --- sessions ---

    @Override
    public synchronized SessionRecord upsertSession(String meetingId, String sessionId) {
        requireMeeting(meetingId, "upsertSession");
        SessionRecord session = new SessionRecord(sessionId, meetingId, SessionStatus.IDLE, null, null);
        sessions.put(sessionId, session);
        return session;
    }

    @Override
    public synchronized void startSession(String sessionId) {
        SessionRecord s = requireSession(sessionId, "startSession");
        sessions.put(sessionId, new SessionRecord(s.id(), s.meetingId(), SessionStatus.RECORDING, clock.millis(), null));
    }

    @Override
    public synchronized void stopSession(String sessionId) {
        SessionRecord s = requireSession(sessionId, "stopSession");
        sessions.put(sessionId, new SessionRecord(s.id(), s.meetingId(), SessionStatus.IDLE, s.startedAt(), clock.millis()));
    }

    @Override
    public synchronized Optional<SessionRecord> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public synchronized List<SessionRecord> loadMeetingSessions(String meetingId) {
        return sessions.values().stream()
                .filter(s -> s.meetingId().equals(meetingId))
                .sorted(Comparator.comparing(SessionRecord::id))
                .toList();
    }

    // --- transcripts ---

    @Override
    public synchronized void persistTranscript(String sessionId, TranscriptSegment segment) {
        SessionRecord session = requireSession(sessionId, "persistTranscript");
        transcriptsBySession.computeIfAbsent(sessionId, k -> new ArrayList<>())
                .add(new Owned<>(session.meetingId(), segment));
    }

    @Override
    public synchronized boolean markUtteranceEnd(String sessionId) {
        List<Owned<TranscriptSegment>> segments = transcriptsBySession.get(sessionId);
        if (segments == null) {
            return false;
        }
        // only the newest final segment is eligible; if it is already flagged the pause
        // belongs to a segment that has not been persisted yet
        for (int i = segments.size() - 1; i >= 0; i--) {
            Owned<TranscriptSegment> owned = segments.get(i);
            if (owned.value().isFinal()) {
                if (owned.value().utteranceEnd()) {
                    return false;
                }
                segments.set(i, new Owned<>(owned.meetingId(), owned.value().withUtteranceEnd()));
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized List<TranscriptSegment> loadMeetingTranscript(String meetingId) {
        List<TranscriptSegment> out = new ArrayList<>();
        for (List<Owned<TranscriptSegment>> segments : transcriptsBySession.values()) {
            for (Owned<TranscriptSegment> owned : segments) {
                if (owned.meetingId().equals(meetingId)) {
                    out.add(owned.value());
                }
            }
        }
        out.sort(Comparator.comparingLong(TranscriptSegment::timestamp));
        return out;
    }

    // --- analyses ---

    @Override
    public synchronized AnalysisRecord persistAnalysis(String sessionId, AnalysisResult result, long timestamp) {
        SessionRecord session = requireSession(sessionId, "persistAnalysis");
        AnalysisRecord record = new AnalysisRecord(nextId++, sessionId, result, timestamp);
        analyses.add(new Owned<>(session.meetingId(), record));
        return record;
    }

    @Override
    public synchronized List<AnalysisRecord> loadMeetingAnalyses(String meetingId) {
        return select(analyses, meetingId, a -> true, AnalysisRecord::timestamp);
    }

    @Override
    public synchronized List<AnalysisRecord> loadRecentMeetingAnalyses(String meetingId, int limit) {
        return lastN(loadMeetingAnalyses(meetingId), limit);
    }

    @Override
    public synchronized List<AnalysisRecord> loadMeetingAnalysesAfter(String meetingId, Long afterExclusive) {
        return select(analyses, meetingId,
                a -> afterExclusive == null || a.timestamp() > afterExclusive,
                AnalysisRecord::timestamp);
    }

    // --- images and captures ---

    @Override
    public synchronized ImageRecord persistImage(String sessionId, GeneratedImage image) {
        SessionRecord session = requireSession(sessionId, "persistImage");
        long id = nextId++;
        String key = "images/" + id + ".png";
        media.put(key, image.base64());
        ImageRecord record = new ImageRecord(id, sessionId, image.prompt(), image.timestamp(), key);
        images.add(new Owned<>(session.meetingId(), record));
        return record;
    }

    @Override
    public synchronized List<ImageRecord> loadMeetingImages(String meetingId) {
        return select(images, meetingId, i -> true, ImageRecord::timestamp);
    }

    @Override
    public synchronized List<ImageRecord> loadRecentMeetingImages(String meetingId, int limit) {
        return lastN(loadMeetingImages(meetingId), limit);
    }

    @Override
    public synchronized Optional<ImageRecord> findImage(long imageId) {
        return images.stream().map(Owned::value).filter(i -> i.id() == imageId).findFirst();
    }

    @Override
    public synchronized CaptureRecord persistCapture(String sessionId, CameraFrame frame) {
        SessionRecord session = requireSession(sessionId, "persistCapture");
        long id = nextId++;
        String key = "captures/" + id + ".jpg";
        media.put(key, frame.base64());
        CaptureRecord record = new CaptureRecord(id, sessionId, frame.timestamp(), key);
        captures.add(new Owned<>(session.meetingId(), record));
        return record;
    }

    @Override
    public synchronized List<CaptureRecord> loadMeetingCaptures(String meetingId) {
        return select(captures, meetingId, c -> true, CaptureRecord::timestamp);
    }

    @Override
    public synchronized Optional<CaptureRecord> findCapture(long captureId) {
        return captures.stream().map(Owned::value).filter(c -> c.id() == captureId).findFirst();
    }

    @Override
    public synchronized String loadMediaBase64(String storageKey) {
        String payload = media.get(storageKey);
        if (payload == null) {
            throw new StorageException("loadMedia", "Media not found: " + storageKey);
        }
        return payload;
    }

    // --- audio recordings ---

    @Override
    public synchronized AudioRecord persistAudio(String sessionId, byte[] content) {
        SessionRecord session = requireSession(sessionId, "persistAudio");
        long id = nextId++;
        String key = "audio/" + sessionId + "/" + id + ".webm";
        audio.put(key, content.clone());
        AudioRecord record = new AudioRecord(id, sessionId, session.meetingId(), content.length, clock.millis(), key);
        audioRecords.add(record);
        LOG.debug("Audio stored (session={}, bytes={})", sessionId, content.length);
        return record;
    }

    @Override
    public synchronized List<AudioRecord> loadMeetingAudio(String meetingId) {
        return audioRecords.stream()
                .filter(a -> a.meetingId().equals(meetingId))
                .sorted(Comparator.comparingLong(AudioRecord::createdAt).thenComparingLong(AudioRecord::id))
                .toList();
    }

    @Override
    public synchronized Optional<AudioRecord> findAudio(long audioId) {
        return audioRecords.stream().filter(a -> a.id() == audioId).findFirst();
    }

    @Override
    public synchronized byte[] loadAudio(String storageKey) {
        byte[] content = audio.get(storageKey);
        if (content == null) {
            throw new StorageException("loadAudio", "Audio not found: " + storageKey);
        }
        return content.clone();
    }

    // --- meta-summaries ---

    @Override
    public synchronized MetaSummary persistMetaSummary(String meetingId, long startTime, long endTime,
                                                       List<String> summary, List<String> themes,
                                                       Long representativeImageId) {
        requireMeeting(meetingId, "persistMetaSummary");
        List<MetaSummary> existing = metaSummaries.computeIfAbsent(meetingId, k -> new ArrayList<>());
        if (!existing.isEmpty() && startTime <= existing.get(existing.size() - 1).endTime()) {
            throw new StorageException("persistMetaSummary",
                    "Meta-summary interval overlaps the previous one for meeting " + meetingId);
        }
        MetaSummary created = new MetaSummary(nextId++, meetingId, startTime, endTime, summary, themes,
                representativeImageId, clock.millis());
        existing.add(created);
        return created;
    }

    @Override
    public synchronized List<MetaSummary> loadMetaSummaries(String meetingId) {
        return List.copyOf(metaSummaries.getOrDefault(meetingId, List.of()));
    }

    @Override
    public synchronized Optional<MetaSummary> findLatestMetaSummary(String meetingId) {
        List<MetaSummary> list = metaSummaries.getOrDefault(meetingId, List.of());
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
    }

    // --- speaker aliases ---

    @Override
    public synchronized SpeakerAlias upsertSpeakerAlias(String meetingId, int speaker, String displayName) {
        requireMeeting(meetingId, "upsertSpeakerAlias");
        SpeakerAlias alias = new SpeakerAlias(meetingId, speaker, displayName, clock.millis());
        aliases.computeIfAbsent(meetingId, k -> new TreeMap<>()).put(speaker, alias);
        return alias;
    }

    @Override
    public synchronized void deleteSpeakerAlias(String meetingId, int speaker) {
        TreeMap<Integer, SpeakerAlias> byMeeting = aliases.get(meetingId);
        if (byMeeting != null) {
            byMeeting.remove(speaker);
        }
    }

    @Override
    public synchronized List<SpeakerAlias> loadSpeakerAliases(String meetingId) {
        return List.copyOf(aliases.getOrDefault(meetingId, new TreeMap<>()).values());
    }

    // --- helpers ---

    private Meeting requireMeeting(String meetingId, String operation) {
        Meeting meeting = meetings.get(meetingId);
        if (meeting == null) {
            throw new StorageException(operation, "Unknown meeting " + meetingId);
        }
        return meeting;
    }

    private SessionRecord requireSession(String sessionId, String operation) {
        SessionRecord session = sessions.get(sessionId);
        if (session == null) {
            throw new StorageException(operation, "Unknown session " + sessionId);
        }
        return session;
    }

    private static <T> List<T> select(List<Owned<T>> source, String meetingId, Predicate<T> filter, ToLongFunction<T> ts) {
        return source.stream()
                .filter(owned -> owned.meetingId().equals(meetingId))
                .map(Owned::value)
                .filter(filter)
                .sorted(Comparator.comparingLong(ts))
                .toList();
    }

    private static <T> List<T> lastN(List<T> ascending, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, ascending.size() - limit);
        return List.copyOf(ascending.subList(from, ascending.size()));
    }

    private record Owned<T>(String meetingId, T value) {
    }
}
