package com.phillippitts.graphicrecorder.presentation.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.graphicrecorder.config.logging.ConnectionMdc;
import com.phillippitts.graphicrecorder.config.properties.PendingAudioProperties;
import com.phillippitts.graphicrecorder.config.properties.WebSocketProperties;
import com.phillippitts.graphicrecorder.service.meeting.ImageModelService;
import com.phillippitts.graphicrecorder.service.meeting.MeetingService;
import com.phillippitts.graphicrecorder.service.session.ConnectionContext;
import com.phillippitts.graphicrecorder.service.session.MeetingConnections;
import com.phillippitts.graphicrecorder.service.session.SessionOrchestrator;
import com.phillippitts.graphicrecorder.util.Ids;
import com.phillippitts.graphicrecorder.util.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.ByteBuffer;
import java.security.Principal;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * WebSocket endpoint of the recorder.
 *
 * <p>Each connection gets a {@link ConnectionContext} whose serial executor runs every
 * frame, timer tick and provider completion of that connection in order, with the
 * connection's MDC keys set. The container thread only copies the frame and posts it.
 *
 * <p>A client may pass {@code ?sessionId=} to keep its session id across a reload; a newer
 * connection with the same id supersedes the older one.
 */
@Component
public class RecordingWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(RecordingWebSocketHandler.class);

    static final String CONTEXT_ATTRIBUTE = "graphicrecorder.connection";
    static final String ANONYMOUS_USER = "anonymous";

    private final MessageRouter router;
    private final SessionOrchestrator sessions;
    private final MeetingService meetings;
    private final ImageModelService imageModels;
    private final MeetingConnections connections;
    private final Executor connectionExecutor;
    private final ObjectMapper mapper;
    private final WebSocketProperties webSocketProperties;
    private final PendingAudioProperties pendingAudioProperties;
    private final Clock clock;

    public RecordingWebSocketHandler(MessageRouter router,
                                     SessionOrchestrator sessions,
                                     MeetingService meetings,
                                     ImageModelService imageModels,
                                     MeetingConnections connections,
                                     @Qualifier("connectionExecutor") Executor connectionExecutor,
                                     ObjectMapper mapper,
                                     WebSocketProperties webSocketProperties,
                                     PendingAudioProperties pendingAudioProperties,
                                     Clock clock) {
        this.router = router;
        this.sessions = sessions;
        this.meetings = meetings;
        this.imageModels = imageModels;
        this.connections = connections;
        this.connectionExecutor = connectionExecutor;
        this.mapper = mapper;
        this.webSocketProperties = webSocketProperties;
        this.pendingAudioProperties = pendingAudioProperties;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        session.setBinaryMessageSizeLimit(webSocketProperties.getMaxBinaryMessageBytes());
        session.setTextMessageSizeLimit(webSocketProperties.getMaxBinaryMessageBytes());
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(session,
                webSocketProperties.getSendTimeLimitMs(), webSocketProperties.getSendBufferSizeLimit());

        String connectionId = session.getId();
        String sessionId = resolveSessionId(session);
        SerialExecutor serial = new SerialExecutor(connectionExecutor);
        AtomicReference<ConnectionContext> self = new AtomicReference<>();
        Executor executor = task -> serial.execute(ConnectionMdc.wrap(connectionId, sessionId,
                () -> self.get() == null ? null : self.get().meetingId(), task));

        ConnectionContext ctx = new ConnectionContext(connectionId, sessionId, resolveUserId(session),
                new WebSocketClientConnection(outbound, mapper), executor, pendingAudioProperties.toLimits());
        self.set(ctx);
        session.getAttributes().put(CONTEXT_ATTRIBUTE, ctx);

        ctx.post(() -> {
            ConnectionContext previous = connections.register(ctx);
            if (previous != null) {
                previous.markSuperseded();
                previous.connection().close();
            }
            LOG.info("Connection opened (remote={})", session.getRemoteAddress());
            ctx.send(imageModels.status(ctx));
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionContext ctx = contextOf(session);
        if (ctx == null) {
            return;
        }
        String payload = message.getPayload();
        ctx.post(() -> router.route(ctx, payload));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ConnectionContext ctx = contextOf(session);
        if (ctx == null) {
            return;
        }
        ByteBuffer data = message.getPayload();
        byte[] chunk = new byte[data.remaining()];
        data.get(chunk);
        ctx.post(() -> router.routeBinary(ctx, chunk));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("WebSocket transport error (connection={}): {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionContext ctx = contextOf(session);
        if (ctx == null) {
            return;
        }
        // not ctx.post: teardown must run even though the connection is closing
        ctx.executor().execute(() -> {
            sessions.cleanup(ctx);
            meetings.releaseRecordingLock(ctx);
            connections.unregister(ctx);
            ctx.markClosed();
            LOG.info("Connection closed (code={}, superseded={})", status.getCode(), ctx.isSuperseded());
        });
    }

    private String resolveSessionId(WebSocketSession session) {
        String requested = session.getUri() == null ? null
                : UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst("sessionId");
        if (requested != null && Ids.isValidSessionId(requested)) {
            return requested;
        }
        if (requested != null) {
            LOG.warn("Ignoring malformed sessionId query parameter");
        }
        return Ids.newSessionId(clock.millis());
    }

    private static String resolveUserId(WebSocketSession session) {
        Principal principal = session.getPrincipal();
        return principal == null ? ANONYMOUS_USER : principal.getName();
    }

    private static ConnectionContext contextOf(WebSocketSession session) {
        return (ConnectionContext) session.getAttributes().get(CONTEXT_ATTRIBUTE);
    }
}
