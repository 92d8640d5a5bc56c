package com.phillippitts.graphicrecorder.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the recording pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Pending-audio drops per reason code</li>
 *   <li>Rejected audio uploads and report exports per reason code</li>
 *   <li>Recording-lock conflicts</li>
 *   <li>Protocol errors on inbound frames</li>
 *   <li>Analysis latency and meta-summary compactions</li>
 *   <li>Best-effort persistence failures per operation</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class RecordingMetrics {

    private static final String METRIC_PREFIX = "graphicrecorder";

    private final MeterRegistry registry;

    public RecordingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementAudioDropped(String reason) {
        Counter.builder(METRIC_PREFIX + ".audio.dropped")
                .description("Audio chunks refused by the pending-audio guard")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementAudioUploadRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".audio.upload.rejected")
                .description("Audio uploads refused before they were stored")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementReportRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".report.rejected")
                .description("Report exports refused before the archive was built")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementLockConflict() {
        Counter.builder(METRIC_PREFIX + ".lock.conflict")
                .description("Recording starts refused because another session holds the meeting")
                .register(registry)
                .increment();
    }

    public void incrementProtocolError() {
        Counter.builder(METRIC_PREFIX + ".protocol.error")
                .description("Inbound frames that could not be parsed or had an unknown type")
                .register(registry)
                .increment();
    }

    /**
     * Records one analysis round trip (context build plus provider call).
     */
    public void recordAnalysis(long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".analysis.latency")
                .description("Time from analysis trigger to result")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementMetaSummary() {
        Counter.builder(METRIC_PREFIX + ".metasummary.generated")
                .description("Meta-summaries compacted into the medium-term context tier")
                .register(registry)
                .increment();
    }

    public void incrementPersistenceFailure(String operation) {
        Counter.builder(METRIC_PREFIX + ".persistence.failure")
                .description("Best-effort persistence writes that failed")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
