package com.phillippitts.graphicrecorder.service.session;

import com.phillippitts.graphicrecorder.domain.AnalysisResult;
import com.phillippitts.graphicrecorder.domain.GeneratedImage;
import com.phillippitts.graphicrecorder.domain.GenerationPhase;
import com.phillippitts.graphicrecorder.protocol.ServerMessage;
import com.phillippitts.graphicrecorder.protocol.ServerMessages;
import com.phillippitts.graphicrecorder.service.provider.AnalysisRequest;
import com.phillippitts.graphicrecorder.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the analysis and image pipeline for one recording session.
 *
 * <p>At most one pass is in flight. Provider completions are re-posted to the connection
 * before touching session state, and anything that completes after {@link #dispose()} is
 * ignored.
 */
public final class AnalysisCoordinator {

    private static final Logger LOG = LogManager.getLogger(AnalysisCoordinator.class);

    private final ConnectionContext ctx;
    private final SessionState session;
    private final String meetingId;
    private final AnalysisCoordinators deps;

    private boolean inProgress;
    private boolean disposed;

    AnalysisCoordinator(ConnectionContext ctx, SessionState session, String meetingId, AnalysisCoordinators deps) {
        this.ctx = ctx;
        this.session = session;
        this.meetingId = meetingId;
        this.deps = deps;
    }

    /** Starts a pass when the trigger condition holds. Must run on the connection executor. */
    public void checkAndRun() {
        if (disposed || inProgress) {
            return;
        }
        long now = deps.clock().millis();
        if (!session.shouldTriggerAnalysis(now, deps.properties().getIntervalMs(),
                deps.properties().getWordThreshold())) {
            return;
        }
        run(now);
    }

    public boolean isInProgress() {
        return inProgress;
    }

    public void dispose() {
        disposed = true;
    }

    private void run(long now) {
        String transcript = session.transcriptSinceLastAnalysis();
        List<String> previousTopics = session.previousTopics();
        String model = deps.imageModels().resolveModel(ctx.imagePreset());
        session.markAnalysisStarted(now);
        inProgress = true;
        long startNanos = System.nanoTime();
        LOG.info("Starting analysis ({} words of new transcript)", SessionState.countWords(transcript));
        broadcast(ServerMessages.generationStatus(GenerationPhase.ANALYZING, null));

        deps.compaction().buildContext(meetingId, transcript, session.cameraFrames())
                .thenComposeAsync(context -> deps.providers().analysis()
                        .analyze(new AnalysisRequest(transcript, previousTopics, context)), deps.providerExecutor())
                .whenComplete((result, error) -> ctx.post(() -> onAnalysis(result, error, startNanos, model)));
    }

    private void onAnalysis(AnalysisResult result, Throwable error, long startNanos, String model) {
        if (disposed) {
            return;
        }
        long duration = System.nanoTime() - startNanos;
        if (error != null) {
            deps.metrics().recordAnalysis(duration, false);
            fail("Analysis", error);
            return;
        }
        deps.metrics().recordAnalysis(duration, true);
        session.recordAnalysis(result);
        broadcast(ServerMessages.analysis(result));

        String sessionId = ctx.sessionId();
        long timestamp = deps.clock().millis();
        deps.writer().submit("persistAnalysis", () -> deps.store().persistAnalysis(sessionId, result, timestamp))
                .thenCompose(saved -> deps.compaction().checkAndCompact(meetingId));

        if (result.imagePrompt().isBlank()) {
            LOG.info("Analysis returned no image prompt; skipping image generation");
            finish();
            return;
        }
        broadcast(ServerMessages.generationStatus(GenerationPhase.GENERATING, null));
        CompletableFuture.supplyAsync(() -> deps.providers().image()
                        .generate(result.imagePrompt(), model, attempt -> ctx.post(() -> onRetrying(attempt))),
                        deps.providerExecutor())
                .thenCompose(generating -> generating)
                .whenComplete((image, imageError) -> ctx.post(() -> onImage(image, imageError)));
    }

    private void onRetrying(int attempt) {
        if (disposed || !inProgress) {
            return;
        }
        broadcast(ServerMessages.generationStatus(GenerationPhase.RETRYING, attempt));
    }

    private void onImage(GeneratedImage image, Throwable error) {
        if (disposed) {
            return;
        }
        if (error != null) {
            fail("Image generation", error);
            return;
        }
        session.recordImage(image);
        broadcast(ServerMessages.image(image));
        String sessionId = ctx.sessionId();
        deps.writer().submit("persistImage", () -> deps.store().persistImage(sessionId, image));
        finish();
    }

    private void fail(String stage, Throwable error) {
        LOG.warn("{} failed: {}", stage, ErrorSanitizer.sanitize(error));
        ctx.send(ServerMessages.error(ErrorSanitizer.sanitize(error), null));
        finish();
    }

    private void finish() {
        inProgress = false;
        broadcast(ServerMessages.generationStatus(GenerationPhase.IDLE, null));
    }

    private void broadcast(ServerMessage message) {
        deps.connections().broadcastFrom(ctx, message);
    }
}
