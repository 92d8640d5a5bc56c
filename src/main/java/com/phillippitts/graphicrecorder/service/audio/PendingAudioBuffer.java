package com.phillippitts.graphicrecorder.service.audio;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FIFO of raw audio chunks held while the transcription leg opens.
 *
 * <p>Invariant: {@link #byteCount()} always equals the sum of buffered chunk sizes and
 * never exceeds the configured cap. Once {@link #drain()} has been called the buffer is
 * spent and refuses further chunks; the owner starts a new buffer for the next recording
 * attempt.
 *
 * <p>Not thread-safe: owned by a single connection task.
 */
public final class PendingAudioBuffer {

    private final ArrayDeque<byte[]> chunks = new ArrayDeque<>();
    private final PendingAudioLimits limits;
    private long byteCount;
    private boolean drained;

    public PendingAudioBuffer(PendingAudioLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    /**
     * Appends the chunk if the guard admits it. The chunk array is kept as-is, so callers
     * must hand over a copy they no longer touch.
     */
    public Admission offer(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (drained) {
            return Admission.rejected(DropReason.DRAINED);
        }
        Admission admission = PendingAudioGuard.admit(chunk.length, chunks.size(), byteCount, limits);
        if (admission.canBuffer()) {
            chunks.addLast(chunk);
            byteCount += chunk.length;
        }
        return admission;
    }

    /**
     * Removes and returns all chunks in arrival order, then marks the buffer spent.
     */
    public List<byte[]> drain() {
        List<byte[]> out = new ArrayList<>(chunks);
        chunks.clear();
        byteCount = 0;
        drained = true;
        return out;
    }

    /** Discards everything buffered; the buffer is spent afterwards. */
    public void clear() {
        chunks.clear();
        byteCount = 0;
        drained = true;
    }

    public int chunkCount() {
        return chunks.size();
    }

    public long byteCount() {
        return byteCount;
    }

    public boolean isDrained() {
        return drained;
    }

    public PendingAudioLimits limits() {
        return limits;
    }
}
