package com.phillippitts.graphicrecorder.service.audio;

/** Why an audio chunk was refused by the pending-audio guard. */
public enum DropReason {
    MAX_CHUNKS("max_chunks"),
    MAX_BYTES("max_bytes"),
    /** Offered to a buffer that was already flushed into the transcription leg. */
    DRAINED("drained");

    private final String code;

    DropReason(String code) {
        this.code = code;
    }

    /** Reason code used in logs and metric tags. */
    public String code() {
        return code;
    }
}
