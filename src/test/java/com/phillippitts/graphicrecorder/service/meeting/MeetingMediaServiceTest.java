package com.phillippitts.graphicrecorder.service.meeting;

import com.phillippitts.graphicrecorder.config.properties.AudioUploadProperties;
import com.phillippitts.graphicrecorder.domain.AudioRecord;
import com.phillippitts.graphicrecorder.domain.CameraFrame;
import com.phillippitts.graphicrecorder.domain.GeneratedImage;
import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.service.persistence.InMemoryMeetingStore;
import com.phillippitts.graphicrecorder.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class MeetingMediaServiceTest {

    private static final String WEBM = "audio/webm";

    private MutableClock clock;
    private InMemoryMeetingStore store;
    private SimpleMeterRegistry registry;
    private AudioUploadProperties audioUpload;
    private MeetingMediaService media;
    private String meetingA;
    private String meetingB;
    private long imageId;
    private long captureId;

    private static String b64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    private static InputStream body(int size) {
        return new ByteArrayInputStream(new byte[size]);
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryMeetingStore(clock);
        registry = new SimpleMeterRegistry();
        audioUpload = new AudioUploadProperties();
        audioUpload.setMaxBytes(1024);
        media = new MeetingMediaService(store, audioUpload, new RecordingMetrics(registry));
        meetingA = store.createMeeting("A", null).id();
        meetingB = store.createMeeting("B", null).id();
        store.upsertSession(meetingA, "s1");
        store.upsertSession(meetingB, "s2");
        imageId = store.persistImage("s1", new GeneratedImage(b64("png-bytes"), "p", 1)).id();
        captureId = store.persistCapture("s1", new CameraFrame(b64("jpg-bytes"), 2)).id();
    }

    private static ErrorCode codeOf(ThrowingCall call) {
        try {
            call.run();
        } catch (DomainException e) {
            return e.getCode();
        } catch (Exception e) {
            throw new AssertionError("expected DomainException", e);
        }
        throw new AssertionError("expected DomainException");
    }

    private double rejected(String reason) {
        return registry.counter("graphicrecorder.audio.upload.rejected", "reason", reason).count();
    }

    @Test
    void loadsDecodedPayloads() {
        assertThat(new String(media.loadImage(meetingA, imageId), StandardCharsets.UTF_8)).isEqualTo("png-bytes");
        assertThat(new String(media.loadCapture(meetingA, captureId), StandardCharsets.UTF_8)).isEqualTo("jpg-bytes");
    }

    @Test
    void mediaOfAnotherMeetingIsNotFound() {
        assertThat(codeOf(() -> media.loadImage(meetingB, imageId))).isEqualTo(ErrorCode.MEDIA_NOT_FOUND);
        assertThat(codeOf(() -> media.loadCapture(meetingB, captureId))).isEqualTo(ErrorCode.MEDIA_NOT_FOUND);
    }

    @Test
    void unknownIdsAreNotFound() {
        assertThat(codeOf(() -> media.loadImage(meetingA, 9999))).isEqualTo(ErrorCode.MEDIA_NOT_FOUND);
        assertThat(codeOf(() -> media.loadImage(meetingA, captureId))).isEqualTo(ErrorCode.MEDIA_NOT_FOUND);
        assertThat(codeOf(() -> media.loadImage("00000000-0000-4000-8000-000000000000", imageId)))
                .isEqualTo(ErrorCode.MEETING_NOT_FOUND);
    }

    @Test
    void malformedMeetingIdIsRejected() {
        assertThatThrownBy(() -> media.loadCapture("../etc", captureId))
                .isInstanceOf(DomainException.class)
                .hasMessage("Invalid meeting ID format");
    }

    @Test
    void uploadedAudioIsServedToItsOwnMeetingOnly() throws Exception {
        byte[] audio = "webm-audio".getBytes(StandardCharsets.UTF_8);

        AudioRecord record = media.uploadAudio(meetingA, "audio/webm;codecs=opus", "10", "s1",
                new ByteArrayInputStream(audio));

        assertThat(record.sessionId()).isEqualTo("s1");
        assertThat(record.meetingId()).isEqualTo(meetingA);
        assertThat(record.sizeBytes()).isEqualTo(10);
        assertThat(media.loadAudio(meetingA, record.id())).isEqualTo(audio);
        assertThat(codeOf(() -> media.loadAudio(meetingB, record.id()))).isEqualTo(ErrorCode.MEDIA_NOT_FOUND);
        assertThat(codeOf(() -> media.loadAudio(meetingA, imageId))).isEqualTo(ErrorCode.MEDIA_NOT_FOUND);
    }

    @Test
    void recordingsAreListedNewestFirst() throws Exception {
        long first = media.uploadAudio(meetingA, WEBM, null, "s1", body(4)).id();
        clock.advance(Duration.ofSeconds(1));
        long second = media.uploadAudio(meetingA, WEBM, null, "s1", body(4)).id();

        assertThat(media.listAudio(meetingA)).extracting(AudioRecord::id).containsExactly(second, first);
        assertThat(media.listAudio(meetingB)).isEmpty();
    }

    @Test
    void declaredLengthOverTheCapIsRefusedBeforeReadingTheBody() {
        InputStream untouched = mock(InputStream.class);

        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "1025", "s1", untouched)))
                .isEqualTo(ErrorCode.AUDIO_UPLOAD_TOO_LARGE);

        verifyNoInteractions(untouched);
        assertThat(rejected("size-limit")).isEqualTo(1.0);
        assertThat(store.loadMeetingAudio(meetingA)).isEmpty();
    }

    @Test
    void bodyOverTheCapIsCutOffWhileReading() {
        // no Content-Length, then a Content-Length that understates the body
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, null, "s1", body(1025))))
                .isEqualTo(ErrorCode.AUDIO_UPLOAD_TOO_LARGE);
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "10", "s1", body(20_000))))
                .isEqualTo(ErrorCode.AUDIO_UPLOAD_TOO_LARGE);

        assertThat(rejected("size-limit")).isEqualTo(2.0);
        assertThat(store.loadMeetingAudio(meetingA)).isEmpty();
    }

    @Test
    void uploadExactlyAtTheCapIsAccepted() throws Exception {
        AudioRecord record = media.uploadAudio(meetingA, WEBM, "1024", "s1", body(1024));

        assertThat(record.sizeBytes()).isEqualTo(1024);
    }

    @Test
    void nonWebmContentTypeIsRefused() {
        assertThat(codeOf(() -> media.uploadAudio(meetingA, "audio/mpeg", "4", "s1", body(4))))
                .isEqualTo(ErrorCode.UNSUPPORTED_AUDIO_TYPE);
        assertThat(codeOf(() -> media.uploadAudio(meetingA, null, "4", "s1", body(4))))
                .isEqualTo(ErrorCode.UNSUPPORTED_AUDIO_TYPE);
        assertThat(rejected("content-type")).isEqualTo(2.0);
    }

    @Test
    void malformedContentLengthIsRefused() {
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "12abc", "s1", body(4))))
                .isEqualTo(ErrorCode.INVALID_AUDIO_UPLOAD);
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "-1", "s1", body(4))))
                .isEqualTo(ErrorCode.INVALID_AUDIO_UPLOAD);
    }

    @Test
    void sessionMustBelongToTheMeeting() {
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "4", null, body(4))))
                .isEqualTo(ErrorCode.INVALID_SESSION_ID);
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "4", "bad id!", body(4))))
                .isEqualTo(ErrorCode.INVALID_SESSION_ID);
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "4", "s2", body(4))))
                .isEqualTo(ErrorCode.SESSION_NOT_FOUND);
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "4", "unknown", body(4))))
                .isEqualTo(ErrorCode.SESSION_NOT_FOUND);
    }

    @Test
    void emptyBodyIsRefused() {
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, "0", "s1", body(0))))
                .isEqualTo(ErrorCode.INVALID_AUDIO_UPLOAD);
        assertThat(codeOf(() -> media.uploadAudio(meetingA, WEBM, null, "s1", null)))
                .isEqualTo(ErrorCode.INVALID_AUDIO_UPLOAD);
        assertThat(rejected("empty")).isEqualTo(2.0);
    }

    @Test
    void uploadToUnknownMeetingIsNotFound() {
        assertThat(codeOf(() -> media.uploadAudio("00000000-0000-4000-8000-000000000000", WEBM, "4", "s1", body(4))))
                .isEqualTo(ErrorCode.MEETING_NOT_FOUND);
    }

    @Test
    void contentLengthParsingAcceptsOnlyDigits() {
        assertThat(MeetingMediaService.parseContentLength(" 42 ")).contains(42L);
        assertThat(MeetingMediaService.parseContentLength("4.2")).isEmpty();
        assertThat(MeetingMediaService.parseContentLength("")).isEmpty();
        assertThat(MeetingMediaService.parseContentLength("99999999999999999999999")).contains(Long.MAX_VALUE);
    }

    @Test
    void listingUnknownMeetingIsNotFound() {
        assertThat(codeOf(() -> media.listAudio("00000000-0000-4000-8000-000000000000")))
                .isEqualTo(ErrorCode.MEETING_NOT_FOUND);
    }

    @FunctionalInterface
    private interface ThrowingCall {
        void run() throws Exception;
    }
}
