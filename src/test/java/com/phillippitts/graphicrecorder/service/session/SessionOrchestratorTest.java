package com.phillippitts.graphicrecorder.service.session;

import com.phillippitts.graphicrecorder.domain.SessionStatus;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.ErrorData;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.SessionStatusData;
import com.phillippitts.graphicrecorder.service.audio.DropReason;
import com.phillippitts.graphicrecorder.service.audio.PendingAudioLimits;
import com.phillippitts.graphicrecorder.service.events.AudioChunkDroppedEvent;
import com.phillippitts.graphicrecorder.service.events.RecordingLockConflictEvent;
import com.phillippitts.graphicrecorder.testutil.FakeTranscriptionService.Open;
import com.phillippitts.graphicrecorder.testutil.ManualTimers;
import com.phillippitts.graphicrecorder.testutil.RecorderHarness;
import com.phillippitts.graphicrecorder.testutil.RecorderHarness.Client;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SessionOrchestratorTest {

    private static final String SESSION_START = "{\"type\":\"session:start\"}";
    private static final String SESSION_STOP = "{\"type\":\"session:stop\"}";

    private RecorderHarness h;

    @BeforeEach
    void setUp() {
        h = new RecorderHarness();
    }

    private String createMeeting(Client client) {
        h.send(client, "{\"type\":\"meeting:start\",\"data\":{\"title\":\"Standup\"}}");
        return client.ctx().meetingId();
    }

    private void join(Client client, String meetingId, String mode) {
        h.send(client, "{\"type\":\"meeting:start\",\"data\":{\"meetingId\":\"" + meetingId
                + "\",\"mode\":\"" + mode + "\"}}");
    }

    private TranscriptSegment finalSegment(String text) {
        return new TranscriptSegment(text, h.clock.millis(), true, 0, 1.5, false);
    }

    @Test
    void startRequiresMeeting() {
        Client client = h.connect("s1");

        h.send(client, SESSION_START);

        assertThat(client.connection().errors()).extracting(ErrorData::code).containsExactly("NO_ACTIVE_MEETING");
        assertThat(h.transcription.opens()).isEmpty();
    }

    @Test
    void startInViewModeIsRejected() {
        Client owner = h.connect("s1");
        String meetingId = createMeeting(owner);
        Client viewer = h.connect("s2");
        join(viewer, meetingId, "view");

        h.send(viewer, SESSION_START);

        assertThat(viewer.connection().errors()).extracting(ErrorData::code).containsExactly("READ_ONLY_MEETING");
        assertThat(h.locks.holderOf(meetingId)).isEmpty();
    }

    @Test
    void startTakesLockOpensLegAndReportsRecording() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);

        h.send(client, SESSION_START);

        assertThat(client.connection().sessionStatuses()).containsExactly("recording");
        assertThat(h.locks.holderOf(meetingId)).contains("s1");
        assertThat(client.ctx().isRecording()).isTrue();
        assertThat(h.store.findSession("s1").orElseThrow().status()).isEqualTo(SessionStatus.RECORDING);
        assertThat(h.timers.pending()).anyMatch(ManualTimers.Scheduled::isRepeating);
    }

    @Test
    void repeatedStartWhileRecordingOnlyRepeatsStatus() {
        Client client = h.connect("s1");
        createMeeting(client);
        h.send(client, SESSION_START);

        h.send(client, SESSION_START);

        assertThat(h.transcription.opens()).hasSize(1);
        assertThat(client.connection().sessionStatuses()).containsExactly("recording", "recording");
    }

    @Test
    void audioBeforeLegOpensIsFlushedInArrivalOrder() {
        h.transcription.holdOpens();
        Client client = h.connect("s1");
        createMeeting(client);
        h.send(client, SESSION_START);

        h.sendBinary(client, new byte[]{1});
        h.sendBinary(client, new byte[]{2});
        h.sendBinary(client, new byte[]{3});
        assertThat(client.ctx().pendingAudio().chunkCount()).isEqualTo(3);

        Open open = h.transcription.lastOpen();
        open.complete();
        h.sendBinary(client, new byte[]{4});

        assertThat(open.stream().chunks()).extracting(chunk -> chunk[0])
                .containsExactly((byte) 1, (byte) 2, (byte) 3, (byte) 4);
        assertThat(client.ctx().pendingAudio().chunkCount()).isZero();
        assertThat(client.connection().sessionStatuses()).containsExactly("recording");
    }

    @Test
    void audioOverflowWhilePendingIsDroppedAndReported() {
        h.transcription.holdOpens();
        Client client = h.connect("s1", new PendingAudioLimits(2, 1024));
        createMeeting(client);
        h.send(client, SESSION_START);

        h.sendBinary(client, new byte[]{1});
        h.sendBinary(client, new byte[]{2});
        h.sendBinary(client, new byte[]{3});
        h.transcription.lastOpen().complete();

        assertThat(h.transcription.lastOpen().stream().chunks()).hasSize(2);
        List<AudioChunkDroppedEvent> drops = h.events.eventsOf(AudioChunkDroppedEvent.class);
        assertThat(drops).hasSize(1);
        assertThat(drops.get(0).reason()).isEqualTo(DropReason.MAX_CHUNKS);
        assertThat(drops.get(0).sessionId()).isEqualTo("s1");
        assertThat(client.connection().errors()).isEmpty();
    }

    @Test
    void failedOpenReleasesLockAndDiscardsBufferedAudio() {
        h.transcription.holdOpens();
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);
        h.sendBinary(client, new byte[]{1, 2});

        h.transcription.lastOpen().fail(new IllegalStateException("provider unavailable"));

        List<SessionStatusData> statuses = client.connection().dataOf("session:status", SessionStatusData.class);
        assertThat(statuses).hasSize(1);
        assertThat(statuses.get(0).status()).isEqualTo("error");
        assertThat(statuses.get(0).error()).isEqualTo("provider unavailable");
        assertThat(h.locks.holderOf(meetingId)).isEmpty();
        assertThat(client.ctx().pendingAudio().chunkCount()).isZero();
        assertThat(client.ctx().isTranscriptionOpening()).isFalse();

        // a retry is allowed after the failure
        h.send(client, SESSION_START);
        assertThat(h.transcription.opens()).hasSize(2);
    }

    @Test
    void stopDuringOpenClosesLateLeg() {
        h.transcription.holdOpens();
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);

        h.send(client, SESSION_STOP);
        Open open = h.transcription.lastOpen();
        open.complete();

        assertThat(open.stream().isClosed()).isTrue();
        assertThat(client.ctx().transcription()).isNull();
        assertThat(client.ctx().isRecording()).isFalse();
        assertThat(client.connection().sessionStatuses()).containsExactly("idle");
        assertThat(h.locks.holderOf(meetingId)).isEmpty();
    }

    @Test
    void stopClosesLegCancelsTimerAndPersistsStop() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);
        Open open = h.transcription.lastOpen();

        h.send(client, SESSION_STOP);

        assertThat(open.stream().isClosed()).isTrue();
        assertThat(h.timers.pending()).isEmpty();
        assertThat(h.locks.holderOf(meetingId)).isEmpty();
        assertThat(h.store.findSession("s1").orElseThrow().status()).isEqualTo(SessionStatus.IDLE);
        assertThat(client.connection().sessionStatuses()).containsExactly("recording", "idle");
    }

    @Test
    void secondRecorderIsRefusedWhileLockHeld() {
        Client first = h.connect("s1");
        String meetingId = createMeeting(first);
        Client second = h.connect("s2");
        join(second, meetingId, "record");
        h.send(first, SESSION_START);

        h.send(second, SESSION_START);

        assertThat(second.connection().errors()).extracting(ErrorData::code)
                .containsExactly("MEETING_ALREADY_RECORDING");
        assertThat(h.events.eventsOf(RecordingLockConflictEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.holderSessionId()).isEqualTo("s1"));
        assertThat(h.transcription.opens()).hasSize(1);
    }

    @Test
    void concurrentStartsGrantExactlyOneRecorder() throws Exception {
        Client first = h.connect("s1");
        String meetingId = createMeeting(first);
        Client second = h.connect("s2");
        join(second, meetingId, "record");

        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);
        List<Thread> threads = new ArrayList<>();
        for (Client client : List.of(first, second)) {
            Thread thread = new Thread(() -> {
                ready.countDown();
                try {
                    go.await();
                    h.send(client, SESSION_START);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            threads.add(thread);
            thread.start();
        }
        assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
        go.countDown();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();

        List<Client> recording = new ArrayList<>();
        List<Client> refused = new ArrayList<>();
        for (Client client : List.of(first, second)) {
            if (client.connection().sessionStatuses().contains("recording")) {
                recording.add(client);
            }
            if (client.connection().errors().stream().anyMatch(e -> "MEETING_ALREADY_RECORDING".equals(e.code()))) {
                refused.add(client);
            }
        }
        assertThat(recording).hasSize(1);
        assertThat(refused).hasSize(1);
        assertThat(recording.get(0)).isNotSameAs(refused.get(0));
        assertThat(h.locks.holderOf(meetingId)).contains(recording.get(0).ctx().sessionId());
    }

    @Test
    void transcriptsAreBroadcastToViewersAndFinalsPersisted() {
        Client recorder = h.connect("s1");
        String meetingId = createMeeting(recorder);
        Client viewer = h.connect("s2");
        join(viewer, meetingId, "view");
        h.send(recorder, SESSION_START);
        viewer.connection().clear();

        Open open = h.transcription.lastOpen();
        open.listener().onTranscript(new TranscriptSegment("hel", h.clock.millis(), false, 0, 1.0, false));
        open.listener().onTranscript(finalSegment("hello everyone"));

        assertThat(viewer.connection().types()).containsExactly("transcript", "transcript");
        assertThat(recorder.connection().types()).contains("transcript");
        assertThat(h.store.loadMeetingTranscript(meetingId)).extracting(TranscriptSegment::text)
                .containsExactly("hello everyone");
    }

    @Test
    void utteranceEndBeforeFinalSegmentIsAppliedOnceSegmentIsStored() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);
        Open open = h.transcription.lastOpen();

        open.listener().onUtteranceEnd(h.clock.millis());
        assertThat(client.ctx().pendingUtteranceEnds()).isEqualTo(1);

        open.listener().onTranscript(finalSegment("that wraps it up"));

        assertThat(client.ctx().pendingUtteranceEnds()).isZero();
        assertThat(h.store.loadMeetingTranscript(meetingId)).singleElement()
                .satisfies(segment -> assertThat(segment.utteranceEnd()).isTrue());
        assertThat(client.connection().types()).contains("utterance:end");
    }

    @Test
    void eachPendingUtteranceEndMarksOneLaterFinalSegment() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);
        Open open = h.transcription.lastOpen();

        open.listener().onUtteranceEnd(h.clock.millis());
        open.listener().onUtteranceEnd(h.clock.millis());
        assertThat(client.ctx().pendingUtteranceEnds()).isEqualTo(2);

        open.listener().onTranscript(finalSegment("first"));
        assertThat(client.ctx().pendingUtteranceEnds()).isEqualTo(1);
        open.listener().onTranscript(finalSegment("second"));

        assertThat(client.ctx().pendingUtteranceEnds()).isZero();
        assertThat(h.store.loadMeetingTranscript(meetingId))
                .extracting(TranscriptSegment::utteranceEnd)
                .containsExactly(true, true);
    }

    @Test
    void utteranceEndAfterFinalSegmentMarksItDirectly() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);
        Open open = h.transcription.lastOpen();

        open.listener().onTranscript(finalSegment("first point"));
        open.listener().onUtteranceEnd(h.clock.millis());

        assertThat(client.ctx().pendingUtteranceEnds()).isZero();
        assertThat(h.store.loadMeetingTranscript(meetingId)).singleElement()
                .satisfies(segment -> assertThat(segment.utteranceEnd()).isTrue());
    }

    @Test
    void eventsFromPreviousLegAreIgnored() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);
        Open stale = h.transcription.lastOpen();
        h.send(client, SESSION_STOP);
        h.send(client, SESSION_START);
        client.connection().clear();

        stale.listener().onTranscript(finalSegment("from the old leg"));
        stale.listener().onError(new IllegalStateException("old leg failed"));

        assertThat(client.connection().sent()).isEmpty();
        assertThat(h.store.loadMeetingTranscript(meetingId)).isEmpty();
    }

    @Test
    void providerErrorIsSentSanitized() {
        Client client = h.connect("s1");
        createMeeting(client);
        h.send(client, SESSION_START);

        h.transcription.lastOpen().listener().onError(new IllegalStateException("failed reading /etc/secret"));

        assertThat(client.connection().errors()).extracting(ErrorData::message)
                .containsExactly("An internal error occurred");
    }

    @Test
    void cameraFramesAreKeptAndPersistedWhileRecording() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);
        h.send(client, SESSION_START);

        for (int i = 0; i < 7; i++) {
            h.send(client, "{\"type\":\"camera:frame\",\"data\":{\"base64\":\"ZnJhbWU=\",\"timestamp\":" + i + "}}");
        }

        assertThat(client.ctx().session().cameraFrames()).hasSize(5);
        assertThat(h.store.loadMeetingCaptures(meetingId)).hasSize(7);
    }

    @Test
    void cameraFrameOutsideRecordingIsIgnored() {
        Client client = h.connect("s1");
        String meetingId = createMeeting(client);

        h.send(client, "{\"type\":\"camera:frame\",\"data\":{\"base64\":\"ZnJhbWU=\",\"timestamp\":1}}");

        assertThat(client.connection().errors()).isEmpty();
        assertThat(h.store.loadMeetingCaptures(meetingId)).isEmpty();
    }

    @Test
    void malformedCameraFrameIsRejected() {
        Client client = h.connect("s1");
        createMeeting(client);
        h.send(client, SESSION_START);

        h.send(client, "{\"type\":\"camera:frame\",\"data\":{\"base64\":\"\",\"timestamp\":1}}");
        h.send(client, "{\"type\":\"camera:frame\",\"data\":{\"base64\":\"ZnJhbWU=\",\"timestamp\":\"soon\"}}");
        h.send(client, "{\"type\":\"camera:frame\"}");

        assertThat(client.connection().errors()).extracting(ErrorData::code)
                .containsExactly("INVALID_CAMERA_FRAME", "INVALID_CAMERA_FRAME", "INVALID_CAMERA_FRAME");
    }

    @Test
    void cleanupOfSupersededConnectionLeavesStoredSessionAlone() {
        Client client = h.connect("s1");
        createMeeting(client);
        h.send(client, SESSION_START);

        client.ctx().markSuperseded();
        client.ctx().post(() -> h.sessions.cleanup(client.ctx()));

        assertThat(client.ctx().isRecording()).isFalse();
        assertThat(h.store.findSession("s1").orElseThrow().status()).isEqualTo(SessionStatus.RECORDING);
    }
}
