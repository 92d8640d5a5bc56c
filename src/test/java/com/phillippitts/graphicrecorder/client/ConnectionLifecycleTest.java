package com.phillippitts.graphicrecorder.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.graphicrecorder.config.properties.ReconnectProperties;
import com.phillippitts.graphicrecorder.domain.MeetingMode;
import com.phillippitts.graphicrecorder.testutil.FakeChannelConnector;
import com.phillippitts.graphicrecorder.testutil.FakeChannelConnector.FakeChannel;
import com.phillippitts.graphicrecorder.testutil.ManualTimers;
import com.phillippitts.graphicrecorder.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionLifecycleTest {

    private static final String MEETING_ID = "1b4e28ba-2fa1-41d2-883f-0016d3cca427";

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeChannelConnector connector;
    private ManualTimers timers;
    private ReconnectProperties config;
    private List<ConnectionState> states;
    private List<String> received;
    private ConnectionLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        connector = new FakeChannelConnector();
        timers = new ManualTimers();
        config = new ReconnectProperties();
        states = new ArrayList<>();
        received = new ArrayList<>();
        lifecycle = newLifecycle();
    }

    private ConnectionLifecycle newLifecycle() {
        ConnectionListener listener = new ConnectionListener() {
            @Override
            public void onStateChanged(ConnectionState state) {
                states.add(state);
            }

            @Override
            public void onMessage(String type, JsonNode data) {
                received.add(type);
            }
        };
        return new ConnectionLifecycle(URI.create("ws://localhost/ws/recording"), connector, timers,
                new SyncExecutor(), mapper, config,
                new BackoffPolicy(config.getInitialBackoffMs(), config.getMaxBackoffMs(), 0.0), listener);
    }

    private FakeChannel connectAndOpen() {
        lifecycle.connect();
        FakeChannel channel = connector.last();
        channel.open();
        return channel;
    }

    private List<String> sentTypes(FakeChannel channel) throws IOException {
        List<String> types = new ArrayList<>();
        for (String text : channel.texts()) {
            types.add(mapper.readTree(text).get("type").asText());
        }
        return types;
    }

    private JsonNode sent(FakeChannel channel, int index) throws IOException {
        return mapper.readTree(channel.texts().get(index));
    }

    private static String meetingStatus(String mode) {
        return "{\"type\":\"meeting:status\",\"data\":{\"meetingId\":\"" + MEETING_ID
                + "\",\"title\":\"Sync\",\"sessionId\":\"s1\",\"mode\":\"" + mode + "\"}}";
    }

    private static final String RECORDING = "{\"type\":\"session:status\",\"data\":{\"status\":\"recording\"}}";

    @Test
    void startsDisconnectedAndConnectsThroughConnecting() {
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.DISCONNECTED);

        lifecycle.connect();
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.CONNECTING);

        connector.last().open();
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.CONNECTED);
        assertThat(states).extracting(ConnectionState::phase)
                .containsExactly(ConnectionPhase.CONNECTING, ConnectionPhase.CONNECTED);
    }

    @Test
    void connectWhileConnectingOrConnectedIsNoOp() {
        lifecycle.connect();
        lifecycle.connect();
        connector.last().open();
        lifecycle.connect();

        assertThat(connector.channels()).hasSize(1);
    }

    @Test
    void unexpectedCloseMidRecordingReconnectsAndReplaysMeetingThenSession() throws IOException {
        FakeChannel first = connectAndOpen();
        first.receive(meetingStatus("record"));
        first.receive(RECORDING);
        assertThat(lifecycle.state().recording()).isTrue();

        first.drop(1006, "abnormal");

        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.RECONNECTING);
        assertThat(lifecycle.state().reconnectAttempt()).isEqualTo(1);
        assertThat(timers.pending()).hasSize(1);
        assertThat(timers.pending().get(0).delay()).isEqualTo(Duration.ofMillis(250));

        timers.fireNext();
        FakeChannel second = connector.last();
        assertThat(second).isNotSameAs(first);
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.RECONNECTING);

        second.open();

        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.CONNECTED);
        assertThat(lifecycle.state().reconnectAttempt()).isZero();
        assertThat(sentTypes(second)).containsExactly("meeting:start", "session:start");
        JsonNode replay = sent(second, 0).get("data");
        assertThat(replay.get("meetingId").asText()).isEqualTo(MEETING_ID);
        assertThat(replay.get("mode").asText()).isEqualTo("record");
    }

    @Test
    void replayOmitsSessionStartWhenNotRecording() throws IOException {
        FakeChannel first = connectAndOpen();
        first.receive(meetingStatus("view"));
        first.drop(1001, "going away");
        timers.fireNext();
        FakeChannel second = connector.last();
        second.open();

        assertThat(sentTypes(second)).containsExactly("meeting:start");
        assertThat(sent(second, 0).get("data").get("mode").asText()).isEqualTo("view");
    }

    @Test
    void snapshotSurvivesRepeatedFailuresAndBackoffGrows() throws IOException {
        FakeChannel first = connectAndOpen();
        first.receive(meetingStatus("record"));
        first.drop(1006, "abnormal");

        timers.fireNext();
        connector.last().drop(1006, "refused");
        assertThat(lifecycle.state().reconnectAttempt()).isEqualTo(2);
        assertThat(timers.pending().get(0).delay()).isEqualTo(Duration.ofMillis(500));

        timers.fireNext();
        FakeChannel third = connector.last();
        third.open();

        assertThat(sentTypes(third)).containsExactly("meeting:start");
    }

    @Test
    void noReplayWithoutMeeting() {
        FakeChannel first = connectAndOpen();
        first.drop(1006, "abnormal");
        timers.fireNext();
        FakeChannel second = connector.last();
        second.open();

        assertThat(second.texts()).isEmpty();
    }

    @Test
    void explicitDisconnectCancelsReconnectAndDiscardsSnapshot() {
        FakeChannel first = connectAndOpen();
        first.receive(meetingStatus("record"));
        first.drop(1006, "abnormal");
        ManualTimers.Scheduled reconnect = timers.pending().get(0);

        lifecycle.disconnect();

        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.DISCONNECTED);
        assertThat(reconnect.isCancelled()).isTrue();

        // a late scheduler thread still runs the callback: it must not reconnect
        timers.fireRegardless(reconnect);
        assertThat(connector.channels()).hasSize(1);

        FakeChannel fresh = connectAndOpen();
        assertThat(fresh.texts()).isEmpty();
    }

    @Test
    void disconnectClosesOpenChannelWithoutReconnect() {
        FakeChannel channel = connectAndOpen();

        lifecycle.disconnect();
        channel.drop(1000, "normal");

        assertThat(channel.isClosed()).isTrue();
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.DISCONNECTED);
        assertThat(timers.pending()).isEmpty();
    }

    @Test
    void watchdogForceClosesStuckConnectAndSchedulesReconnect() {
        lifecycle.connect();
        FakeChannel stuck = connector.last();
        assertThat(timers.pending()).hasSize(1);
        assertThat(timers.pending().get(0).delay()).isEqualTo(Duration.ofMillis(4000));

        timers.fireNext();

        assertThat(stuck.isClosed()).isTrue();
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.RECONNECTING);
        assertThat(lifecycle.state().error()).isEqualTo("Connection timed out");

        // the stuck socket finally reports: ignored
        stuck.open();
        stuck.drop(1006, "late");
        assertThat(lifecycle.state().reconnectAttempt()).isEqualTo(1);
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.RECONNECTING);
    }

    @Test
    void openCancelsWatchdog() {
        lifecycle.connect();
        ManualTimers.Scheduled watchdog = timers.pending().get(0);

        connector.last().open();

        assertThat(watchdog.isCancelled()).isTrue();
    }

    @Test
    void staleWatchdogAfterReconnectIsIgnored() {
        lifecycle.connect();
        ManualTimers.Scheduled firstWatchdog = timers.pending().get(0);
        connector.last().open();
        connector.last().drop(1006, "abnormal");
        timers.fireNext();
        connector.last().open();

        timers.fireRegardless(firstWatchdog);

        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.CONNECTED);
        assertThat(connector.last().isClosed()).isFalse();
    }

    @Test
    void eventsFromReplacedChannelAreDropped() {
        FakeChannel first = connectAndOpen();
        first.drop(1006, "abnormal");
        timers.fireNext();
        FakeChannel second = connector.last();
        second.open();

        first.receive(meetingStatus("record"));
        first.drop(1006, "again");

        assertThat(lifecycle.state().meetingId()).isNull();
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.CONNECTED);
        assertThat(received).isEmpty();
    }

    @Test
    void reconnectDisabledLeavesDisconnected() {
        config.setEnabled(false);
        lifecycle = newLifecycle();
        FakeChannel first = connectAndOpen();

        first.drop(1006, "abnormal");

        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.DISCONNECTED);
        assertThat(timers.pending()).isEmpty();
    }

    @Test
    void disposeSilencesListenerAndRejectsConnect() {
        connectAndOpen();
        int before = states.size();

        lifecycle.dispose();
        lifecycle.connect();

        assertThat(states).hasSize(before);
        assertThat(connector.channels()).hasSize(1);
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.DISCONNECTED);
    }

    @Test
    void stopMeetingClearsLocalMeetingSoNothingIsReplayed() {
        FakeChannel first = connectAndOpen();
        first.receive(meetingStatus("record"));

        lifecycle.stopMeeting();
        first.drop(1006, "abnormal");
        timers.fireNext();
        FakeChannel second = connector.last();
        second.open();

        assertThat(lifecycle.state().meetingId()).isNull();
        assertThat(second.texts()).isEmpty();
    }

    @Test
    void tracksMeetingAndRecordingFromServerStatus() {
        FakeChannel channel = connectAndOpen();

        channel.receive(meetingStatus("record"));
        channel.receive(RECORDING);

        ConnectionState state = lifecycle.state();
        assertThat(state.meetingId()).isEqualTo(MEETING_ID);
        assertThat(state.mode()).isEqualTo(MeetingMode.RECORD);
        assertThat(state.recording()).isTrue();
        assertThat(received).containsExactly("meeting:status", "session:status");

        channel.receive("{\"type\":\"session:status\",\"data\":{\"status\":\"idle\"}}");
        assertThat(lifecycle.state().recording()).isFalse();
    }

    @Test
    void malformedServerFramesAreIgnored() {
        FakeChannel channel = connectAndOpen();

        channel.receive("not json");
        channel.receive("{\"data\":{}}");

        assertThat(received).isEmpty();
        assertThat(lifecycle.state().phase()).isEqualTo(ConnectionPhase.CONNECTED);
    }

    @Test
    void convenienceSendersProduceControlFrames() throws IOException {
        FakeChannel channel = connectAndOpen();

        lifecycle.startMeeting("Kickoff", null, MeetingMode.RECORD);
        lifecycle.updateSpeakerAlias(2, "Dana");
        lifecycle.setImageModelPreset("pro");
        lifecycle.sendCameraFrame("ZnJhbWU=", 1234L);
        lifecycle.requestMeetingList();
        lifecycle.sendAudio(new byte[]{1, 2, 3});

        assertThat(sentTypes(channel)).containsExactly("meeting:start", "meeting:speaker-alias:update",
                "image:model:set", "camera:frame", "meeting:list:request");
        JsonNode start = sent(channel, 0).get("data");
        assertThat(start.get("title").asText()).isEqualTo("Kickoff");
        assertThat(start.has("meetingId")).isFalse();
        assertThat(sent(channel, 1).get("data").get("speaker").asInt()).isEqualTo(2);
        assertThat(sent(channel, 3).get("data").get("base64").asText()).isEqualTo("ZnJhbWU=");
        assertThat(sent(channel, 4).has("data")).isFalse();
        assertThat(channel.binaries()).hasSize(1);
        assertThat(channel.binaries().get(0)).containsExactly(1, 2, 3);
    }

    @Test
    void sendsAreDroppedWhileNotConnected() {
        lifecycle.connect();
        FakeChannel channel = connector.last();

        lifecycle.startSession();
        lifecycle.sendAudio(new byte[]{9});

        assertThat(channel.texts()).isEmpty();
        assertThat(channel.binaries()).isEmpty();
    }

    @Test
    void stopSessionWhileDisconnectedSuppressesSessionReplay() throws IOException {
        FakeChannel first = connectAndOpen();
        first.receive(meetingStatus("record"));
        first.receive(RECORDING);
        first.drop(1006, "abnormal");

        lifecycle.stopSession();
        timers.fireNext();
        FakeChannel second = connector.last();
        second.open();

        assertThat(sentTypes(second)).containsExactly("meeting:start");
    }

    @Test
    void channelErrorIsSurfacedInState() {
        FakeChannel channel = connectAndOpen();

        channel.fail(new IOException("connection reset"));

        assertThat(lifecycle.state().error()).isEqualTo("connection reset");
    }
}
