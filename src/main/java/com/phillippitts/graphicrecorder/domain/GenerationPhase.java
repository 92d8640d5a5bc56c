package com.phillippitts.graphicrecorder.domain;

/** Progress of the analyze-then-render pipeline, reported on {@code generation:status}. */
public enum GenerationPhase {
    IDLE("idle"),
    ANALYZING("analyzing"),
    GENERATING("generating"),
    RETRYING("retrying");

    private final String wire;

    GenerationPhase(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
