package com.phillippitts.graphicrecorder.service.audio;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PendingAudioBufferTest {

    @Test
    void buffersThreeChunksThenRejectsFourthForChunkCount() {
        PendingAudioBuffer buffer = new PendingAudioBuffer(new PendingAudioLimits(3, 1024));

        for (int i = 0; i < 3; i++) {
            assertThat(buffer.offer(new byte[300]).canBuffer()).isTrue();
        }
        assertThat(buffer.chunkCount()).isEqualTo(3);
        assertThat(buffer.byteCount()).isEqualTo(900);

        Admission fourth = buffer.offer(new byte[100]);

        assertThat(fourth.canBuffer()).isFalse();
        assertThat(fourth.reason()).isEqualTo(DropReason.MAX_CHUNKS);
        assertThat(buffer.chunkCount()).isEqualTo(3);
        assertThat(buffer.byteCount()).isEqualTo(900);
    }

    @Test
    void keepsBufferedChunksWhenRejectingForBytes() {
        PendingAudioBuffer buffer = new PendingAudioBuffer(new PendingAudioLimits(10, 1000));
        buffer.offer(new byte[600]);

        Admission rejected = buffer.offer(new byte[500]);

        assertThat(rejected.reason()).isEqualTo(DropReason.MAX_BYTES);
        assertThat(buffer.chunkCount()).isEqualTo(1);
        assertThat(buffer.byteCount()).isEqualTo(600);
    }

    @Test
    void drainReturnsChunksInArrivalOrderAndSpendsBuffer() {
        PendingAudioBuffer buffer = new PendingAudioBuffer(new PendingAudioLimits(10, 1000));
        byte[] first = {1};
        byte[] second = {2, 2};
        buffer.offer(first);
        buffer.offer(second);

        List<byte[]> drained = buffer.drain();

        assertThat(drained).containsExactly(first, second);
        assertThat(buffer.chunkCount()).isZero();
        assertThat(buffer.byteCount()).isZero();
        assertThat(buffer.isDrained()).isTrue();
        assertThat(buffer.offer(new byte[1]).reason()).isEqualTo(DropReason.DRAINED);
    }

    @Test
    void clearDiscardsEverything() {
        PendingAudioBuffer buffer = new PendingAudioBuffer(new PendingAudioLimits(10, 1000));
        buffer.offer(new byte[10]);

        buffer.clear();

        assertThat(buffer.chunkCount()).isZero();
        assertThat(buffer.byteCount()).isZero();
        assertThat(buffer.drain()).isEmpty();
    }

    @Test
    void byteCountMatchesSumOfChunksUnderMixedTraffic() {
        PendingAudioLimits limits = new PendingAudioLimits(8, 2000);
        PendingAudioBuffer buffer = new PendingAudioBuffer(limits);
        int[] sizes = {100, 700, 50, 900, 400, 10, 10, 10, 10, 10, 10};

        long accepted = 0;
        for (int size : sizes) {
            if (buffer.offer(new byte[size]).canBuffer()) {
                accepted += size;
            }
            assertThat(buffer.byteCount()).isLessThanOrEqualTo(limits.maxBytes());
            assertThat(buffer.chunkCount()).isLessThanOrEqualTo(limits.maxChunks());
        }

        assertThat(buffer.byteCount()).isEqualTo(accepted);
        assertThat(buffer.drain().stream().mapToLong(c -> c.length).sum()).isEqualTo(accepted);
    }
}
