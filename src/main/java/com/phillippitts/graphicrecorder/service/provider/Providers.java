package com.phillippitts.graphicrecorder.service.provider;

import com.phillippitts.graphicrecorder.exception.ProviderException;
import com.phillippitts.graphicrecorder.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves the external provider clients.
 *
 * <p>Concrete speech, LLM and image clients are deployment concerns and are plugged in as
 * beans. Any that are missing fall back to a placeholder that fails every call with a
 * "not configured" error, so the socket layer still answers with a proper error frame.
 */
@Component
public class Providers {

    private static final Logger LOG = LogManager.getLogger(Providers.class);

    private final TranscriptionService transcription;
    private final AnalysisProvider analysis;
    private final ImageProvider image;
    private final MetaSummarizer metaSummarizer;

    @Autowired
    public Providers(ObjectProvider<TranscriptionService> transcription,
                     ObjectProvider<AnalysisProvider> analysis,
                     ObjectProvider<ImageProvider> image,
                     ObjectProvider<MetaSummarizer> metaSummarizer) {
        this(transcription.getIfAvailable(Providers::unconfiguredTranscription),
                analysis.getIfAvailable(() -> request -> notConfigured("analysis")),
                image.getIfAvailable(() -> (prompt, model, onRetrying) -> notConfigured("image")),
                metaSummarizer.getIfAvailable(() -> input -> notConfigured("meta-summary")));
        if (!this.transcription.isConfigured()) {
            LOG.warn("No transcription provider configured; session:start will report an error");
        }
    }

    public Providers(TranscriptionService transcription, AnalysisProvider analysis,
                     ImageProvider image, MetaSummarizer metaSummarizer) {
        this.transcription = Objects.requireNonNull(transcription, "transcription");
        this.analysis = Objects.requireNonNull(analysis, "analysis");
        this.image = Objects.requireNonNull(image, "image");
        this.metaSummarizer = Objects.requireNonNull(metaSummarizer, "metaSummarizer");
    }

    public TranscriptionService transcription() {
        return transcription;
    }

    public AnalysisProvider analysis() {
        return analysis;
    }

    public ImageProvider image() {
        return image;
    }

    public MetaSummarizer metaSummarizer() {
        return metaSummarizer;
    }

    private static <T> CompletableFuture<T> notConfigured(String provider) {
        return CompletableFuture.failedFuture(new ProviderException(provider, "Provider is not configured"));
    }

    private static TranscriptionService unconfiguredTranscription() {
        return new TranscriptionService() {
            @Override
            public CompletableFuture<TranscriptionStream> open(TranscriptionListener listener) {
                return CompletableFuture.failedFuture(
                        new TranscriptionException("Transcription provider is not configured", name()));
            }

            @Override
            public String name() {
                return "unconfigured";
            }

            @Override
            public boolean isConfigured() {
                return false;
            }
        };
    }
}
