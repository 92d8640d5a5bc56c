package com.phillippitts.graphicrecorder.service.health;

import com.phillippitts.graphicrecorder.service.lock.RecordingLockManager;
import com.phillippitts.graphicrecorder.service.provider.Providers;
import com.phillippitts.graphicrecorder.service.session.MeetingConnections;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the recording pipeline.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: a transcription provider is configured</li>
 *   <li>DEGRADED: no transcription provider; meetings can be viewed but not recorded</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RecordingHealthIndicator implements HealthIndicator {

    private final Providers providers;
    private final RecordingLockManager locks;
    private final MeetingConnections connections;

    public RecordingHealthIndicator(Providers providers, RecordingLockManager locks,
                                    MeetingConnections connections) {
        this.providers = providers;
        this.locks = locks;
        this.connections = connections;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        if (providers.transcription().isConfigured()) {
            builder.up().withDetail("transcription", providers.transcription().name());
        } else {
            builder.status("DEGRADED").withDetail("transcription", "not configured");
        }
        return builder
                .withDetail("activeRecordings", locks.activeLockCount())
                .withDetail("openConnections", connections.openConnectionCount())
                .build();
    }
}
