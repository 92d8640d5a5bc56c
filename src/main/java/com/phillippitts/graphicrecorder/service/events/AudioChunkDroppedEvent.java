package com.phillippitts.graphicrecorder.service.events;

import com.phillippitts.graphicrecorder.service.audio.DropReason;

import java.time.Instant;

/**
 * Published when an inbound audio chunk is refused by the pending-audio guard.
 *
 * Carries sizes only, never audio content.
 */
public record AudioChunkDroppedEvent(String sessionId, DropReason reason, int chunkBytes,
                                     int pendingChunks, long pendingBytes, Instant at) { }
