package com.phillippitts.graphicrecorder.service.provider;

import com.phillippitts.graphicrecorder.domain.GeneratedImage;

import java.util.concurrent.CompletableFuture;
import java.util.function.IntConsumer;

/** Renders the graphic-recording image for an analysis. */
@FunctionalInterface
public interface ImageProvider {

    /**
     * @param prompt     image prompt produced by the analysis
     * @param model      resolved model name for the connection's preset
     * @param onRetrying called with the attempt number before each provider retry
     */
    CompletableFuture<GeneratedImage> generate(String prompt, String model, IntConsumer onRetrying);
}
