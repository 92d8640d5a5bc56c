package com.phillippitts.graphicrecorder.domain;

/** Lifecycle status of a recording session as reported on {@code session:status}. */
public enum SessionStatus {
    IDLE("idle"),
    RECORDING("recording"),
    PROCESSING("processing"),
    ERROR("error");

    private final String wire;

    SessionStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
