package com.phillippitts.graphicrecorder.service.events;

import java.time.Instant;

/**
 * Published when a session is refused a meeting's recording lock because another session
 * holds it.
 */
public record RecordingLockConflictEvent(String meetingId, String sessionId, String holderSessionId,
                                         Instant at) { }
