package com.phillippitts.graphicrecorder.presentation.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.graphicrecorder.protocol.ClientConnection;
import com.phillippitts.graphicrecorder.protocol.ServerMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring {@link WebSocketSession}. The session is expected
 * to be a {@code ConcurrentWebSocketSessionDecorator}, which serializes concurrent sends.
 */
final class WebSocketClientConnection implements ClientConnection {

    private static final Logger LOG = LogManager.getLogger(WebSocketClientConnection.class);

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    WebSocketClientConnection(WebSocketSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(ServerMessage message) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(mapper.writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {} frame", message.type(), e);
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send {} frame (connection={}): {}", message.type(), id(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            LOG.warn("Failed to close connection {}: {}", id(), e.getMessage());
        }
    }
}
