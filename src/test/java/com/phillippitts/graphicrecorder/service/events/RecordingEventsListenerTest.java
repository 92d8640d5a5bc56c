package com.phillippitts.graphicrecorder.service.events;

import com.phillippitts.graphicrecorder.service.audio.DropReason;
import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingEventsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MutableClock clock = new MutableClock();
    private final RecordingEventsListener listener = new RecordingEventsListener(new RecordingMetrics(registry), clock);

    @Test
    void throttlesRepeatLogs() {
        assertThat(listener.shouldLog("audio-drop-s1")).isTrue();
        assertThat(listener.shouldLog("audio-drop-s1")).isFalse();
        assertThat(listener.shouldLog("audio-drop-s2")).isTrue();

        clock.advance(Duration.ofSeconds(61));
        assertThat(listener.shouldLog("audio-drop-s1")).isTrue();
    }

    @Test
    void countsEveryDropEvenWhenLogIsThrottled() {
        for (int i = 0; i < 3; i++) {
            listener.onAudioChunkDropped(new AudioChunkDroppedEvent("s1", DropReason.MAX_BYTES, 4096,
                    10, 4_194_304L, clock.instant()));
        }

        assertThat(registry.counter("graphicrecorder.audio.dropped", "reason", "max_bytes").count()).isEqualTo(3.0);
    }

    @Test
    void countsLockConflicts() {
        listener.onLockConflict(new RecordingLockConflictEvent("m1", "s2", "s1", clock.instant()));
        listener.onLockConflict(new RecordingLockConflictEvent("m1", "s2", "s1", clock.instant()));

        assertThat(registry.counter("graphicrecorder.lock.conflict").count()).isEqualTo(2.0);
    }
}
