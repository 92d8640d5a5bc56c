package com.phillippitts.graphicrecorder.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.graphicrecorder.config.properties.ReconnectProperties;
import com.phillippitts.graphicrecorder.service.timer.Timers;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Creates {@link ConnectionLifecycle}s wired to the application's timers, executor and
 * reconnect settings.
 */
@Component
public class RecordingClients {

    private final ObjectMapper mapper;
    private final Timers timers;
    private final Executor executor;
    private final ReconnectProperties properties;
    private final ChannelConnector connector;

    public RecordingClients(ObjectMapper mapper,
                            Timers timers,
                            @Qualifier("connectionExecutor") Executor executor,
                            ReconnectProperties properties) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.connector = new SpringWebSocketConnector(new StandardWebSocketClient());
    }

    public ConnectionLifecycle create(URI uri, ConnectionListener listener) {
        BackoffPolicy backoff = new BackoffPolicy(properties.getInitialBackoffMs(),
                properties.getMaxBackoffMs(), properties.getJitterRatio());
        return new ConnectionLifecycle(uri, connector, timers, executor, mapper, properties, backoff, listener);
    }
}
