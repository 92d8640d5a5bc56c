package com.phillippitts.graphicrecorder.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionMdcTest {

    @BeforeEach
    void setUp() {
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void setsKeysWhileTaskRuns() {
        Map<String, String> seen = new HashMap<>();

        ConnectionMdc.wrap("conn-1", "s1", () -> "m1", () -> seen.putAll(ThreadContext.getContext())).run();

        assertThat(seen).containsEntry(ConnectionMdc.CONNECTION_ID, "conn-1")
                .containsEntry(ConnectionMdc.SESSION_ID, "s1")
                .containsEntry(ConnectionMdc.MEETING_ID, "m1");
        assertThat(ThreadContext.get(ConnectionMdc.CONNECTION_ID)).isNull();
    }

    @Test
    void readsMeetingWhenTaskRuns() {
        AtomicReference<String> meeting = new AtomicReference<>();
        AtomicReference<String> seen = new AtomicReference<>("unset");
        Runnable task = ConnectionMdc.wrap("conn-1", "s1", meeting::get,
                () -> seen.set(ThreadContext.get(ConnectionMdc.MEETING_ID)));

        task.run();
        assertThat(seen.get()).isNull();

        meeting.set("m2");
        task.run();
        assertThat(seen.get()).isEqualTo("m2");
    }

    @Test
    void restoresPreviousContextEvenOnFailure() {
        ThreadContext.put("requestId", "outer");

        Runnable failing = ConnectionMdc.wrap("conn-1", "s1", () -> null, () -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(failing::run).isInstanceOf(IllegalStateException.class);
        assertThat(ThreadContext.get("requestId")).isEqualTo("outer");
        assertThat(ThreadContext.get(ConnectionMdc.SESSION_ID)).isNull();
    }

    @Test
    void propagatingCarriesCapturedContextToAnotherThread() throws Exception {
        ThreadContext.put(ConnectionMdc.SESSION_ID, "s9");
        Runnable task = ConnectionMdc.propagating(() -> {
            throw new IllegalStateException("checked below");
        });
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable reading = ConnectionMdc.propagating(() -> seen.set(ThreadContext.get(ConnectionMdc.SESSION_ID)));
        ThreadContext.clearAll();

        Thread worker = new Thread(reading);
        worker.start();
        worker.join(5000);

        assertThat(seen.get()).isEqualTo("s9");
        assertThatThrownBy(task::run).isInstanceOf(IllegalStateException.class);
        assertThat(ThreadContext.get(ConnectionMdc.SESSION_ID)).isNull();
    }
}
