package com.phillippitts.graphicrecorder.client.recording;

import java.util.function.Consumer;

@FunctionalInterface
public interface AudioRecorderFactory {

    AudioRecorder create(AudioStream stream, Consumer<byte[]> onChunk, Consumer<Throwable> onError);
}
