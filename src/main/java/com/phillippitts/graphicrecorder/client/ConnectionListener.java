package com.phillippitts.graphicrecorder.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives lifecycle notifications on the lifecycle's loop thread. Implementations must
 * not block.
 */
public interface ConnectionListener {

    default void onStateChanged(ConnectionState state) {
    }

    /**
     * A server control frame.
     *
     * @param data the frame's {@code data}, or a missing node when it had none
     */
    default void onMessage(String type, JsonNode data) {
    }
}
