package com.phillippitts.graphicrecorder.protocol;

/**
 * Outbound side of one client connection.
 *
 * <p>{@link #send} is safe to call from any thread; frames to a single connection are
 * delivered in call order. Sending to a closed connection is silently skipped.
 */
public interface ClientConnection {

    String id();

    void send(ServerMessage message);

    boolean isOpen();

    void close();
}
