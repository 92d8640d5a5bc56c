package com.phillippitts.graphicrecorder.service.lock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Grants at most one active recording session per meeting.
 *
 * <p>This map is the only mutable state shared across connections. {@link #acquire} and
 * {@link #release} are single atomic operations on a {@link ConcurrentHashMap}, so any
 * number of connections can race on the same meeting without further locking.
 *
 * <p>Locks live only in this process and only as long as the owning connection; the
 * WebSocket handler releases them on every close path.
 */
@Component
public class RecordingLockManager {

    private static final Logger LOG = LogManager.getLogger(RecordingLockManager.class);

    private final ConcurrentHashMap<String, String> holders = new ConcurrentHashMap<>();

    /**
     * Takes the lock for {@code meetingId}, or confirms it is already held by {@code sessionId}.
     *
     * @return true when {@code sessionId} holds the lock after the call
     */
    public boolean acquire(String meetingId, String sessionId) {
        Objects.requireNonNull(meetingId, "meetingId");
        Objects.requireNonNull(sessionId, "sessionId");
        String existing = holders.putIfAbsent(meetingId, sessionId);
        if (existing == null) {
            LOG.info("Recording lock acquired (meeting={}, session={})", meetingId, sessionId);
            return true;
        }
        if (existing.equals(sessionId)) {
            return true;
        }
        LOG.warn("Recording lock conflict (meeting={}, requester={}, holder={})", meetingId, sessionId, existing);
        return false;
    }

    /**
     * Drops the lock only when {@code sessionId} holds it; otherwise a no-op.
     *
     * @return true when a lock was removed
     */
    public boolean release(String meetingId, String sessionId) {
        if (meetingId == null || sessionId == null) {
            return false;
        }
        boolean removed = holders.remove(meetingId, sessionId);
        if (removed) {
            LOG.info("Recording lock released (meeting={}, session={})", meetingId, sessionId);
        }
        return removed;
    }

    public boolean isLockedByAnother(String meetingId, String sessionId) {
        String holder = holders.get(meetingId);
        return holder != null && !holder.equals(sessionId);
    }

    public Optional<String> holderOf(String meetingId) {
        return Optional.ofNullable(holders.get(meetingId));
    }

    public int activeLockCount() {
        return holders.size();
    }
}
