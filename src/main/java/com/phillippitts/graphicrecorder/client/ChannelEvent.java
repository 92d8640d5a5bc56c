package com.phillippitts.graphicrecorder.client;

/**
 * Everything a duplex channel reports, as one event type consumed by the lifecycle loop.
 *
 * <p>Each event carries the generation of the channel that produced it, so events of a
 * channel that has since been replaced can be recognized and dropped.
 */
public interface ChannelEvent {

    long generation();

    record Opened(long generation) implements ChannelEvent { }

    record Closed(long generation, int code, String reason) implements ChannelEvent { }

    record Message(long generation, String text) implements ChannelEvent { }

    record Errored(long generation, Throwable cause) implements ChannelEvent { }
}
