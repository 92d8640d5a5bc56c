package com.phillippitts.graphicrecorder.client;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link ChannelConnector} over a Spring {@link WebSocketClient}, normally the
 * {@code StandardWebSocketClient}.
 */
public final class SpringWebSocketConnector implements ChannelConnector {

    private static final Logger LOG = LogManager.getLogger(SpringWebSocketConnector.class);

    /** Close code reported when the handshake itself failed. */
    static final int HANDSHAKE_FAILED = 1006;

    private final WebSocketClient client;

    public SpringWebSocketConnector(WebSocketClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public DuplexChannel open(URI uri, long generation, Consumer<ChannelEvent> events) {
        SessionChannel channel = new SessionChannel();
        client.execute(new ForwardingHandler(channel, generation, events), new WebSocketHttpHeaders(), uri)
                .whenComplete((session, error) -> {
                    if (error != null) {
                        LOG.debug("Handshake with {} failed: {}", uri, error.getMessage());
                        events.accept(new ChannelEvent.Errored(generation, error));
                        events.accept(new ChannelEvent.Closed(generation, HANDSHAKE_FAILED, "Handshake failed"));
                    }
                });
        return channel;
    }

    private static final class ForwardingHandler extends AbstractWebSocketHandler {

        private final SessionChannel channel;
        private final long generation;
        private final Consumer<ChannelEvent> events;

        ForwardingHandler(SessionChannel channel, long generation, Consumer<ChannelEvent> events) {
            this.channel = channel;
            this.generation = generation;
            this.events = events;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            if (channel.attach(session)) {
                events.accept(new ChannelEvent.Opened(generation));
            }
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            events.accept(new ChannelEvent.Message(generation, message.getPayload()));
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            events.accept(new ChannelEvent.Errored(generation, exception));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            events.accept(new ChannelEvent.Closed(generation, status.getCode(), status.getReason()));
        }
    }

    /** Sends through the session once the handshake finished; closes it on arrival if closed earlier. */
    private static final class SessionChannel implements DuplexChannel {

        private WebSocketSession session;
        private boolean closed;

        synchronized boolean attach(WebSocketSession opened) {
            if (closed) {
                closeQuietly(opened);
                return false;
            }
            session = opened;
            return true;
        }

        @Override
        public synchronized void sendText(String text) {
            send(new TextMessage(text));
        }

        @Override
        public synchronized void sendBinary(byte[] data) {
            send(new BinaryMessage(data));
        }

        private void send(WebSocketMessage<?> message) {
            if (closed || session == null || !session.isOpen()) {
                LOG.debug("Channel not open; dropping outbound frame");
                return;
            }
            try {
                session.sendMessage(message);
            } catch (IOException e) {
                LOG.warn("Failed to send frame: {}", e.getMessage());
            }
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (session != null) {
                closeQuietly(session);
            }
        }

        private static void closeQuietly(WebSocketSession session) {
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                LOG.warn("Failed to close channel: {}", e.getMessage());
            }
        }
    }
}
