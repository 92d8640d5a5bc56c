package com.phillippitts.graphicrecorder.domain;

/** Connection state of the transcription leg, relayed on {@code stt:status}. */
public enum SttState {
    CONNECTED("connected"),
    RECONNECTING("reconnecting"),
    DISCONNECTED("disconnected"),
    FAILED("failed");

    private final String wire;

    SttState(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
