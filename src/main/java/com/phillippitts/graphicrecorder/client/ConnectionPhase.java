package com.phillippitts.graphicrecorder.client;

/** Phase of a {@link ConnectionLifecycle}. */
public enum ConnectionPhase {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
