package com.phillippitts.graphicrecorder.config.logging;

import org.apache.logging.log4j.ThreadContext;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Puts per-connection correlation keys into the Log4j2 {@link ThreadContext} around a task.
 *
 * <p>WebSocket frames do not pass through a servlet filter, so every task a connection
 * runs is wrapped here instead. The previous context is restored afterwards because the
 * task runs on a pooled thread.
 */
public final class ConnectionMdc {

    public static final String CONNECTION_ID = "connectionId";
    public static final String SESSION_ID = "sessionId";
    public static final String MEETING_ID = "meetingId";

    private ConnectionMdc() {}

    /**
     * Wraps {@code task} so it runs with the given keys. {@code meetingId} is read when the
     * task runs, not when it is wrapped, since a meeting can be joined between the two.
     */
    public static Runnable wrap(String connectionId, String sessionId, Supplier<String> meetingId, Runnable task) {
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.put(CONNECTION_ID, connectionId);
                ThreadContext.put(SESSION_ID, sessionId);
                String meeting = meetingId.get();
                if (meeting != null) {
                    ThreadContext.put(MEETING_ID, meeting);
                } else {
                    ThreadContext.remove(MEETING_ID);
                }
                task.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }

    /**
     * Wraps {@code task} so it runs with the context of the calling thread, captured now.
     * Used for work handed to pools and schedulers.
     */
    public static Runnable propagating(Runnable task) {
        Map<String, String> captured = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.clearMap();
                if (captured != null && !captured.isEmpty()) {
                    ThreadContext.putAll(captured);
                }
                task.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
