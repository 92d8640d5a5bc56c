package com.phillippitts.graphicrecorder.client.recording;

/**
 * Encodes an {@link AudioStream} into chunks. Created per recording attempt by an
 * {@link AudioRecorderFactory}.
 */
public interface AudioRecorder {

    /**
     * Begins capture. Throws when the device cannot be started; chunks and later failures
     * arrive through the callbacks given to the factory.
     */
    void start();

    void stop();
}
