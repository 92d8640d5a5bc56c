package com.phillippitts.graphicrecorder.service.events;

import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for recording back-pressure and lock events. Every event is counted;
 * logging is throttled per key so a stalled transcription leg cannot flood the log.
 */
@Component
class RecordingEventsListener {
    private static final Logger LOG = LogManager.getLogger(RecordingEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final RecordingMetrics metrics;
    private final Clock clock;

    RecordingEventsListener(RecordingMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onAudioChunkDropped(AudioChunkDroppedEvent e) {
        metrics.incrementAudioDropped(e.reason().code());
        if (shouldLog("audio-drop-" + e.sessionId() + '-' + e.reason().code())) {
            LOG.warn("Dropping audio chunk: reason={}, bytes={}, pendingChunks={}, pendingBytes={} (session={})",
                    e.reason().code(), e.chunkBytes(), e.pendingChunks(), e.pendingBytes(), e.sessionId());
        }
    }

    @EventListener
    void onLockConflict(RecordingLockConflictEvent e) {
        metrics.incrementLockConflict();
        if (shouldLog("lock-conflict-" + e.meetingId() + '-' + e.sessionId())) {
            LOG.warn("Recording lock conflict (meeting={}, session={}, holder={})",
                    e.meetingId(), e.sessionId(), e.holderSessionId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
