package com.phillippitts.graphicrecorder.client.recording;

/**
 * An acquired microphone stream.
 */
public interface AudioStream {

    /** Identifies the capture device, for logging. */
    String deviceId();
}
