package com.phillippitts.graphicrecorder.service.session;

import com.phillippitts.graphicrecorder.protocol.ServerMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Registry of open connections: by session id, and by the meeting each one is viewing.
 *
 * <p>Holds references only for fan-out and supersession; it never touches a connection's
 * own state. Live results of a recording session are sent to every connection in the
 * meeting, the recorder included.
 */
@Component
public class MeetingConnections {

    private static final Logger LOG = LogManager.getLogger(MeetingConnections.class);

    private final ConcurrentHashMap<String, ConnectionContext> bySession = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<ConnectionContext>> byMeeting = new ConcurrentHashMap<>();

    /**
     * Registers a newly opened connection.
     *
     * @return the connection previously registered under the same session id, or null
     */
    public ConnectionContext register(ConnectionContext ctx) {
        ConnectionContext previous = bySession.put(ctx.sessionId(), ctx);
        if (previous != null && previous != ctx) {
            LOG.info("Connection superseded (session={}, old={}, new={})",
                    ctx.sessionId(), previous.connectionId(), ctx.connectionId());
            return previous;
        }
        return null;
    }

    public void unregister(ConnectionContext ctx) {
        bySession.remove(ctx.sessionId(), ctx);
        String meetingId = ctx.meetingId();
        if (meetingId != null) {
            leave(meetingId, ctx);
        }
    }

    public void join(String meetingId, ConnectionContext ctx) {
        byMeeting.computeIfAbsent(meetingId, k -> ConcurrentHashMap.newKeySet()).add(ctx);
    }

    public void leave(String meetingId, ConnectionContext ctx) {
        byMeeting.computeIfPresent(meetingId, (k, members) -> {
            members.remove(ctx);
            return members.isEmpty() ? null : members;
        });
    }

    /** Sends {@code message} to every open connection viewing {@code meetingId}. */
    public void broadcast(String meetingId, ServerMessage message) {
        if (meetingId == null) {
            return;
        }
        Set<ConnectionContext> members = byMeeting.get(meetingId);
        if (members == null) {
            return;
        }
        for (ConnectionContext member : members) {
            if (member.connection().isOpen()) {
                member.send(message);
            }
        }
    }

    /**
     * Sends to the meeting when {@code ctx} is in one, otherwise only to {@code ctx}.
     */
    public void broadcastFrom(ConnectionContext ctx, ServerMessage message) {
        String meetingId = ctx.meetingId();
        Set<ConnectionContext> members = meetingId == null ? null : byMeeting.get(meetingId);
        if (members == null || !members.contains(ctx)) {
            ctx.send(message);
            return;
        }
        broadcast(meetingId, message);
    }

    /** Visits every connection viewing {@code meetingId}, open or not. */
    public void forEachMember(String meetingId, Consumer<ConnectionContext> action) {
        Set<ConnectionContext> members = byMeeting.get(meetingId);
        if (members != null) {
            members.forEach(action);
        }
    }

    public int viewerCount(String meetingId) {
        Set<ConnectionContext> members = byMeeting.get(meetingId);
        return members == null ? 0 : members.size();
    }

    public int openConnectionCount() {
        return bySession.size();
    }
}
