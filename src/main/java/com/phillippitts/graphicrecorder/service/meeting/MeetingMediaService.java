package com.phillippitts.graphicrecorder.service.meeting;

import com.phillippitts.graphicrecorder.config.properties.AudioUploadProperties;
import com.phillippitts.graphicrecorder.domain.AudioRecord;
import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.service.persistence.MeetingStore;
import com.phillippitts.graphicrecorder.util.Ids;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Serves stored images, camera captures and session recordings by id, scoped to the
 * meeting they were recorded in. Media of another meeting is reported as missing.
 *
 * <p>Recordings are uploaded once a session stops. An upload must be {@code audio/webm},
 * name a session of the meeting in {@code x-session-id}, and stay within
 * {@link AudioUploadProperties#getMaxBytes()}. The declared {@code Content-Length} is
 * checked first; the body is counted while it is read, so an upload without the header
 * or with a false one is cut off at the same limit.
 */
@Service
public class MeetingMediaService {

    private static final Logger LOG = LogManager.getLogger(MeetingMediaService.class);

    private static final String AUDIO_WEBM = "audio/webm";

    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    // more digits than this cannot be a length that fits in a long
    private static final int MAX_LENGTH_DIGITS = 18;

    private final MeetingStore store;
    private final AudioUploadProperties audioUpload;
    private final RecordingMetrics metrics;

    public MeetingMediaService(MeetingStore store, AudioUploadProperties audioUpload, RecordingMetrics metrics) {
        this.store = store;
        this.audioUpload = audioUpload;
        this.metrics = metrics;
    }

    public byte[] loadImage(String meetingId, long imageId) {
        requireMeeting(meetingId);
        return store.findImage(imageId)
                .filter(image -> belongsTo(image.sessionId(), meetingId))
                .map(image -> decode(store.loadMediaBase64(image.storageKey())))
                .orElseThrow(MeetingMediaService::notFound);
    }

    public byte[] loadCapture(String meetingId, long captureId) {
        requireMeeting(meetingId);
        return store.findCapture(captureId)
                .filter(capture -> belongsTo(capture.sessionId(), meetingId))
                .map(capture -> decode(store.loadMediaBase64(capture.storageKey())))
                .orElseThrow(MeetingMediaService::notFound);
    }

    public byte[] loadAudio(String meetingId, long audioId) {
        requireMeeting(meetingId);
        return store.findAudio(audioId)
                .filter(audio -> meetingId.equals(audio.meetingId()))
                .map(audio -> store.loadAudio(audio.storageKey()))
                .orElseThrow(MeetingMediaService::notFound);
    }

    /** Recordings of the meeting, newest first. */
    public List<AudioRecord> listAudio(String meetingId) {
        requireMeeting(meetingId);
        List<AudioRecord> recordings = new ArrayList<>(store.loadMeetingAudio(meetingId));
        Collections.reverse(recordings);
        return recordings;
    }

    /**
     * Stores one uploaded recording.
     *
     * @param contentType   raw {@code Content-Type} header, or null
     * @param contentLength raw {@code Content-Length} header, or null
     * @param sessionId     raw {@code x-session-id} header, or null
     * @throws DomainException when the upload is refused
     * @throws IOException     when the body cannot be read
     */
    public AudioRecord uploadAudio(String meetingId, String contentType, String contentLength,
                                   String sessionId, InputStream body) throws IOException {
        requireMeeting(meetingId);
        if (contentType == null || !contentType.contains(AUDIO_WEBM)) {
            throw rejectUpload(meetingId, "content-type", ErrorCode.UNSUPPORTED_AUDIO_TYPE,
                    "Content-Type must be audio/webm");
        }
        long maxBytes = audioUpload.getMaxBytes();
        if (contentLength != null) {
            Optional<Long> declared = parseContentLength(contentLength);
            if (declared.isEmpty()) {
                throw rejectUpload(meetingId, "content-length", ErrorCode.INVALID_AUDIO_UPLOAD,
                        "Invalid Content-Length header");
            }
            if (declared.get() > maxBytes) {
                throw rejectUpload(meetingId, "size-limit", ErrorCode.AUDIO_UPLOAD_TOO_LARGE, "File too large");
            }
        }
        if (!Ids.isValidSessionId(sessionId)) {
            throw rejectUpload(meetingId, "session-id", ErrorCode.INVALID_SESSION_ID,
                    "Invalid or missing X-Session-Id header");
        }
        if (!belongsTo(sessionId, meetingId)) {
            throw rejectUpload(meetingId, "unknown-session", ErrorCode.SESSION_NOT_FOUND, "Session not found");
        }

        byte[] audio = readAtMost(meetingId, body, maxBytes);
        if (audio.length == 0) {
            throw rejectUpload(meetingId, "empty", ErrorCode.INVALID_AUDIO_UPLOAD, "Empty body");
        }
        AudioRecord record = store.persistAudio(sessionId, audio);
        LOG.info("Audio recording stored (meeting={}, session={}, id={}, bytes={})",
                meetingId, sessionId, record.id(), record.sizeBytes());
        return record;
    }

    /** Parses a {@code Content-Length} value; digits only, surrounding whitespace allowed. */
    static Optional<Long> parseContentLength(String value) {
        String trimmed = value.trim();
        if (!DIGITS.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        if (trimmed.length() > MAX_LENGTH_DIGITS) {
            return Optional.of(Long.MAX_VALUE);
        }
        return Optional.of(Long.parseLong(trimmed));
    }

    private byte[] readAtMost(String meetingId, InputStream body, long maxBytes) throws IOException {
        if (body == null) {
            return new byte[0];
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                throw rejectUpload(meetingId, "size-limit", ErrorCode.AUDIO_UPLOAD_TOO_LARGE, "File too large");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private DomainException rejectUpload(String meetingId, String reason, ErrorCode code, String message) {
        LOG.warn("Audio upload rejected (meeting={}, reason={})", meetingId, reason);
        metrics.incrementAudioUploadRejected(reason);
        return new DomainException(code, message);
    }

    private void requireMeeting(String meetingId) {
        if (!Ids.isValidMeetingId(meetingId)) {
            throw new DomainException(ErrorCode.INVALID_MEETING_ID, "Invalid meeting ID format");
        }
        if (store.findMeeting(meetingId).isEmpty()) {
            throw new DomainException(ErrorCode.MEETING_NOT_FOUND, "Meeting not found");
        }
    }

    private boolean belongsTo(String sessionId, String meetingId) {
        return store.findSession(sessionId)
                .map(session -> meetingId.equals(session.meetingId()))
                .orElse(false);
    }

    private static byte[] decode(String base64) {
        return Optional.ofNullable(base64).map(Base64.getDecoder()::decode).orElseThrow(MeetingMediaService::notFound);
    }

    private static DomainException notFound() {
        return new DomainException(ErrorCode.MEDIA_NOT_FOUND, "Media not found");
    }
}
