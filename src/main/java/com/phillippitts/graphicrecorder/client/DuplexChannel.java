package com.phillippitts.graphicrecorder.client;

/**
 * Sending side of one client channel instance. Receiving is reported through
 * {@link ChannelEvent}s.
 */
public interface DuplexChannel {

    void sendText(String text);

    void sendBinary(byte[] data);

    /** Closes the channel; safe to call before it opened and more than once. */
    void close();
}
