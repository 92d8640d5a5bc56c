package com.phillippitts.graphicrecorder.service.provider;

/**
 * An open transcription leg accepting raw audio in arrival order.
 */
public interface TranscriptionStream extends AutoCloseable {

    void sendAudio(byte[] chunk);

    /** False while the provider connection is down or reconnecting. */
    boolean isConnected();

    @Override
    void close();
}
