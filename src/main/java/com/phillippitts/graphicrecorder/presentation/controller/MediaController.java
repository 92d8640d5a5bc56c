package com.phillippitts.graphicrecorder.presentation.controller;

import com.phillippitts.graphicrecorder.domain.AudioRecord;
import com.phillippitts.graphicrecorder.service.meeting.MeetingMediaService;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;

/**
 * Media referenced by {@code meeting:history} URLs, and session recordings uploaded after
 * a session stops. Stored media never changes, so downloads are cacheable.
 */
@RestController
@RequestMapping("/api/meetings/{meetingId}")
class MediaController {

    private static final CacheControl IMMUTABLE = CacheControl.maxAge(Duration.ofDays(1)).cachePrivate();
    private static final MediaType AUDIO_WEBM = MediaType.parseMediaType("audio/webm");

    private final MeetingMediaService media;

    MediaController(MeetingMediaService media) {
        this.media = media;
    }

    @GetMapping("/images/{imageId}")
    ResponseEntity<byte[]> image(@PathVariable String meetingId, @PathVariable long imageId) {
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .cacheControl(IMMUTABLE)
                .body(media.loadImage(meetingId, imageId));
    }

    @GetMapping("/captures/{captureId}")
    ResponseEntity<byte[]> capture(@PathVariable String meetingId, @PathVariable long captureId) {
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_JPEG)
                .cacheControl(IMMUTABLE)
                .body(media.loadCapture(meetingId, captureId));
    }

    @GetMapping("/audio")
    AudioRecordingList audioRecordings(@PathVariable String meetingId) {
        List<AudioRecordingView> recordings = media.listAudio(meetingId).stream()
                .map(record -> new AudioRecordingView(record.id(), record.sessionId(), record.sizeBytes(),
                        record.createdAt(), audioUrl(meetingId, record)))
                .toList();
        return new AudioRecordingList(recordings);
    }

    /**
     * Headers are read raw so that a missing or malformed one is answered by the service
     * with the matching error code.
     */
    @PostMapping("/audio")
    AudioUploaded uploadAudio(@PathVariable String meetingId,
                              @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
                              @RequestHeader(value = HttpHeaders.CONTENT_LENGTH, required = false) String contentLength,
                              @RequestHeader(value = "x-session-id", required = false) String sessionId,
                              InputStream body) throws IOException {
        AudioRecord record = media.uploadAudio(meetingId, contentType, contentLength, sessionId, body);
        return new AudioUploaded(record.id(), audioUrl(meetingId, record));
    }

    @GetMapping("/audio/{audioId}")
    ResponseEntity<byte[]> audio(@PathVariable String meetingId, @PathVariable long audioId) {
        return ResponseEntity.ok()
                .contentType(AUDIO_WEBM)
                .cacheControl(IMMUTABLE)
                .body(media.loadAudio(meetingId, audioId));
    }

    private static String audioUrl(String meetingId, AudioRecord record) {
        return "/api/meetings/" + meetingId + "/audio/" + record.id();
    }

    record AudioRecordingView(long id, String sessionId, long fileSizeBytes, long createdAt, String url) {
    }

    record AudioRecordingList(List<AudioRecordingView> recordings) {
    }

    record AudioUploaded(long id, String url) {
    }
}
