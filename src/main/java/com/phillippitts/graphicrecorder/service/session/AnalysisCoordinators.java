package com.phillippitts.graphicrecorder.service.session;

import com.phillippitts.graphicrecorder.config.properties.AnalysisProperties;
import com.phillippitts.graphicrecorder.service.context.ContextCompactionEngine;
import com.phillippitts.graphicrecorder.service.meeting.ImageModelService;
import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.service.persistence.MeetingStore;
import com.phillippitts.graphicrecorder.service.persistence.PersistenceWriter;
import com.phillippitts.graphicrecorder.service.provider.Providers;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Shared collaborators of every {@link AnalysisCoordinator}; creates one per recording
 * session.
 */
@Component
public class AnalysisCoordinators {

    private final ContextCompactionEngine compaction;
    private final Providers providers;
    private final MeetingStore store;
    private final PersistenceWriter writer;
    private final MeetingConnections connections;
    private final ImageModelService imageModels;
    private final AnalysisProperties properties;
    private final Clock clock;
    private final RecordingMetrics metrics;
    private final Executor providerExecutor;

    public AnalysisCoordinators(ContextCompactionEngine compaction,
                                Providers providers,
                                MeetingStore store,
                                PersistenceWriter writer,
                                MeetingConnections connections,
                                ImageModelService imageModels,
                                AnalysisProperties properties,
                                Clock clock,
                                RecordingMetrics metrics,
                                @Qualifier("providerExecutor") Executor providerExecutor) {
        this.compaction = compaction;
        this.providers = providers;
        this.store = store;
        this.writer = writer;
        this.connections = connections;
        this.imageModels = imageModels;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
        this.providerExecutor = providerExecutor;
    }

    public AnalysisCoordinator create(ConnectionContext ctx, SessionState session, String meetingId) {
        return new AnalysisCoordinator(ctx, session, meetingId, this);
    }

    ContextCompactionEngine compaction() {
        return compaction;
    }

    Providers providers() {
        return providers;
    }

    MeetingStore store() {
        return store;
    }

    PersistenceWriter writer() {
        return writer;
    }

    MeetingConnections connections() {
        return connections;
    }

    ImageModelService imageModels() {
        return imageModels;
    }

    AnalysisProperties properties() {
        return properties;
    }

    Clock clock() {
        return clock;
    }

    RecordingMetrics metrics() {
        return metrics;
    }

    Executor providerExecutor() {
        return providerExecutor;
    }
}
