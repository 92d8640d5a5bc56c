package com.phillippitts.graphicrecorder.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.phillippitts.graphicrecorder.config.properties.ReconnectProperties;
import com.phillippitts.graphicrecorder.domain.MeetingMode;
import com.phillippitts.graphicrecorder.protocol.MessageTypes;
import com.phillippitts.graphicrecorder.service.timer.TimerHandle;
import com.phillippitts.graphicrecorder.service.timer.Timers;
import com.phillippitts.graphicrecorder.util.ErrorSanitizer;
import com.phillippitts.graphicrecorder.util.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Client side of the recorder channel: connects, reconnects with backoff after an
 * unexpected loss, and restores the meeting (and recording session) the client was in.
 *
 * <p>All state is confined to one serial loop over the supplied executor. Public methods
 * only enqueue work; channel events and timer callbacks are re-posted onto the loop and
 * checked against the current channel generation, so anything produced by a replaced
 * channel or a superseded timer is dropped.
 *
 * <p>Listener callbacks run on the loop. {@link #state()} may be read from any thread.
 */
public final class ConnectionLifecycle {

    private static final Logger LOG = LogManager.getLogger(ConnectionLifecycle.class);

    private final URI uri;
    private final ChannelConnector connector;
    private final Timers timers;
    private final Executor loop;
    private final ObjectMapper mapper;
    private final ConnectionListener listener;
    private final ReconnectProperties config;
    private final BackoffPolicy backoff;

    // loop-confined
    private ConnectionPhase phase = ConnectionPhase.DISCONNECTED;
    private DuplexChannel channel;
    private long generation;
    private int reconnectAttempt;
    private String error;
    private TimerHandle watchdog = TimerHandle.NONE;
    private TimerHandle reconnectTimer = TimerHandle.NONE;
    private ReconnectSnapshot snapshot;
    private boolean explicitDisconnect;
    private boolean disposed;
    private String meetingId;
    private MeetingMode mode;
    private boolean recording;

    private volatile ConnectionState state = ConnectionState.INITIAL;

    public ConnectionLifecycle(URI uri,
                               ChannelConnector connector,
                               Timers timers,
                               Executor executor,
                               ObjectMapper mapper,
                               ReconnectProperties config,
                               BackoffPolicy backoff,
                               ConnectionListener listener) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.loop = new SerialExecutor(Objects.requireNonNull(executor, "executor"));
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = Objects.requireNonNull(config, "config");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.listener = listener == null ? new ConnectionListener() { } : listener;
    }

    public ConnectionState state() {
        return state;
    }

    public void connect() {
        submit(this::openChannel);
    }

    /** Closes the channel on purpose: no reconnect, no replay. */
    public void disconnect() {
        submit(this::closeExplicitly);
    }

    /** Disconnects and silences this lifecycle for good. */
    public void dispose() {
        submit(() -> {
            disposed = true;
            closeExplicitly();
        });
    }

    // --- convenience senders ---

    public void startMeeting(String title, String meetingId, MeetingMode mode) {
        Map<String, Object> data = new LinkedHashMap<>();
        putIfPresent(data, "title", title);
        putIfPresent(data, "meetingId", meetingId);
        putIfPresent(data, "mode", mode == null ? null : mode.wire());
        submit(() -> sendControl(MessageTypes.MEETING_START, data));
    }

    public void stopMeeting() {
        submit(() -> {
            sendControl(MessageTypes.MEETING_STOP, null);
            meetingId = null;
            mode = null;
            recording = false;
            snapshot = null;
            publish();
        });
    }

    public void startSession() {
        submit(() -> sendControl(MessageTypes.SESSION_START, null));
    }

    public void stopSession() {
        submit(() -> {
            sendControl(MessageTypes.SESSION_STOP, null);
            if (snapshot != null) {
                snapshot = snapshot.withoutRecording();
            }
        });
    }

    /** Sends one audio chunk; dropped while not connected. */
    public void sendAudio(byte[] chunk) {
        byte[] copy = chunk.clone();
        submit(() -> {
            if (phase != ConnectionPhase.CONNECTED || channel == null) {
                LOG.debug("Dropping {}-byte audio chunk while {}", copy.length, phase);
                return;
            }
            channel.sendBinary(copy);
        });
    }

    public void sendCameraFrame(String base64Jpeg, long timestamp) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("base64", base64Jpeg);
        data.put("timestamp", timestamp);
        submit(() -> sendControl(MessageTypes.CAMERA_FRAME, data));
    }

    public void setMeetingMode(MeetingMode mode) {
        submit(() -> sendControl(MessageTypes.MEETING_MODE_SET, Map.of("mode", mode.wire())));
    }

    public void requestMeetingList() {
        submit(() -> sendControl(MessageTypes.MEETING_LIST_REQUEST, null));
    }

    /**
     * @param cursor newest timestamps already held per stream; null or empty for everything
     */
    public void requestHistory(String meetingId, Map<String, Long> cursor) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("meetingId", meetingId);
        if (cursor != null && !cursor.isEmpty()) {
            data.put("cursor", new LinkedHashMap<>(cursor));
        }
        submit(() -> sendControl(MessageTypes.MEETING_HISTORY_REQUEST, data));
    }

    public void updateMeetingTitle(String title) {
        submit(() -> sendControl(MessageTypes.MEETING_UPDATE, Map.of("title", title)));
    }

    public void updateSpeakerAlias(int speaker, String displayName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("speaker", speaker);
        data.put("displayName", displayName);
        submit(() -> sendControl(MessageTypes.MEETING_SPEAKER_ALIAS_UPDATE, data));
    }

    public void setImageModelPreset(String preset) {
        submit(() -> sendControl(MessageTypes.IMAGE_MODEL_SET, Map.of("preset", preset)));
    }

    // --- loop ---

    private void submit(Runnable task) {
        loop.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Connection lifecycle task failed", e);
            }
        });
    }

    private void openChannel() {
        if (disposed) {
            LOG.debug("Ignoring connect on a disposed lifecycle");
            return;
        }
        if (channel != null) {
            return;
        }
        explicitDisconnect = false;
        reconnectTimer.cancel();
        reconnectTimer = TimerHandle.NONE;
        long gen = ++generation;
        phase = reconnectAttempt > 0 ? ConnectionPhase.RECONNECTING : ConnectionPhase.CONNECTING;
        LOG.info("Connecting to {} (attempt={}, generation={})", uri, reconnectAttempt, gen);
        try {
            channel = connector.open(uri, gen, event -> submit(() -> onEvent(event)));
        } catch (RuntimeException e) {
            LOG.warn("Failed to open channel to {}: {}", uri, e.getMessage());
            error = ErrorSanitizer.sanitize(e);
            onChannelLost();
            return;
        }
        if (config.getConnectTimeoutMs() > 0) {
            watchdog = timers.schedule(Duration.ofMillis(config.getConnectTimeoutMs()),
                    () -> submit(() -> onWatchdog(gen)));
        }
        publish();
    }

    private void onEvent(ChannelEvent event) {
        if (event.generation() != generation || channel == null) {
            LOG.debug("Dropping stale {} (generation={}, current={})",
                    event.getClass().getSimpleName(), event.generation(), generation);
            return;
        }
        if (event instanceof ChannelEvent.Opened) {
            onOpened();
        } else if (event instanceof ChannelEvent.Message message) {
            onMessage(message.text());
        } else if (event instanceof ChannelEvent.Errored errored) {
            LOG.warn("Channel error: {}", errored.cause() == null ? "unknown" : errored.cause().getMessage());
            error = ErrorSanitizer.sanitize(errored.cause());
            publish();
        } else if (event instanceof ChannelEvent.Closed closed) {
            LOG.info("Channel closed (code={}, reason={})", closed.code(), closed.reason());
            channel = null;
            onChannelLost();
        }
    }

    private void onOpened() {
        watchdog.cancel();
        watchdog = TimerHandle.NONE;
        reconnectTimer.cancel();
        reconnectTimer = TimerHandle.NONE;
        reconnectAttempt = 0;
        phase = ConnectionPhase.CONNECTED;
        error = null;
        LOG.info("Connected to {}", uri);
        publish();
        ReconnectSnapshot replay = snapshot;
        snapshot = null;
        if (replay != null) {
            LOG.info("Restoring meeting {} (mode={}, recording={})",
                    replay.meetingId(), replay.mode(), replay.wasRecording());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("meetingId", replay.meetingId());
            putIfPresent(data, "mode", replay.mode() == null ? null : replay.mode().wire());
            sendControl(MessageTypes.MEETING_START, data);
            if (replay.wasRecording()) {
                sendControl(MessageTypes.SESSION_START, null);
            }
        }
    }

    private void onWatchdog(long gen) {
        if (gen != generation || channel == null || phase == ConnectionPhase.CONNECTED) {
            return;
        }
        LOG.warn("Connect to {} timed out after {} ms", uri, config.getConnectTimeoutMs());
        DuplexChannel stale = channel;
        channel = null;
        stale.close();
        error = "Connection timed out";
        onChannelLost();
    }

    private void onChannelLost() {
        watchdog.cancel();
        watchdog = TimerHandle.NONE;
        if (explicitDisconnect || disposed) {
            phase = ConnectionPhase.DISCONNECTED;
            publish();
            return;
        }
        if (meetingId != null && snapshot == null) {
            snapshot = new ReconnectSnapshot(meetingId, mode, recording);
        }
        if (!config.isEnabled()) {
            phase = ConnectionPhase.DISCONNECTED;
            LOG.info("Connection lost; reconnect disabled");
            publish();
            return;
        }
        reconnectAttempt++;
        long delay = backoff.delayMillis(reconnectAttempt);
        long gen = generation;
        phase = ConnectionPhase.RECONNECTING;
        reconnectTimer = timers.schedule(Duration.ofMillis(delay), () -> submit(() -> onReconnectDue(gen)));
        LOG.info("Connection lost; reconnecting in {} ms (attempt {})", delay, reconnectAttempt);
        publish();
    }

    private void onReconnectDue(long gen) {
        if (disposed || explicitDisconnect || gen != generation || channel != null) {
            return;
        }
        reconnectTimer = TimerHandle.NONE;
        openChannel();
    }

    private void closeExplicitly() {
        explicitDisconnect = true;
        watchdog.cancel();
        watchdog = TimerHandle.NONE;
        reconnectTimer.cancel();
        reconnectTimer = TimerHandle.NONE;
        DuplexChannel current = channel;
        channel = null;
        generation++;
        if (current != null) {
            current.close();
        }
        snapshot = null;
        reconnectAttempt = 0;
        meetingId = null;
        mode = null;
        recording = false;
        phase = ConnectionPhase.DISCONNECTED;
        LOG.info("Disconnected from {}", uri);
        publish();
    }

    private void onMessage(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring unparseable server frame: {}", e.getOriginalMessage());
            return;
        }
        if (root == null || !root.path("type").isTextual()) {
            LOG.warn("Ignoring server frame without a type");
            return;
        }
        String type = root.get("type").asText();
        JsonNode data = root.has("data") ? root.get("data") : MissingNode.getInstance();
        if (MessageTypes.MEETING_STATUS.equals(type)) {
            meetingId = data.path("meetingId").isTextual() ? data.get("meetingId").asText() : null;
            mode = MeetingMode.fromWire(data.path("mode").asText(null)).orElse(null);
            publish();
        } else if (MessageTypes.SESSION_STATUS.equals(type)) {
            recording = "recording".equals(data.path("status").asText());
            publish();
        }
        if (!disposed) {
            try {
                listener.onMessage(type, data);
            } catch (RuntimeException e) {
                LOG.warn("Connection listener failed on {}: {}", type, e.getMessage());
            }
        }
    }

    private boolean sendControl(String type, Object data) {
        if (phase != ConnectionPhase.CONNECTED || channel == null) {
            LOG.debug("Dropping {} while {}", type, phase);
            return false;
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        if (data != null) {
            frame.put("data", data);
        }
        try {
            channel.sendText(mapper.writeValueAsString(frame));
            return true;
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}", type, e);
            return false;
        }
    }

    private void publish() {
        ConnectionState next = new ConnectionState(phase, reconnectAttempt, error, meetingId, mode, recording);
        state = next;
        if (disposed) {
            return;
        }
        try {
            listener.onStateChanged(next);
        } catch (RuntimeException e) {
            LOG.warn("Connection listener failed on state change: {}", e.getMessage());
        }
    }

    private static void putIfPresent(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }
}
