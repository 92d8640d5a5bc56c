package com.phillippitts.graphicrecorder.client;

import java.net.URI;
import java.util.function.Consumer;

/**
 * Opens channels to the recorder endpoint.
 */
@FunctionalInterface
public interface ChannelConnector {

    /**
     * Starts opening a channel without blocking. Every event of the returned channel is
     * delivered to {@code events}, tagged with {@code generation}, from any thread.
     */
    DuplexChannel open(URI uri, long generation, Consumer<ChannelEvent> events);
}
