package com.phillippitts.graphicrecorder.service.session;

import com.phillippitts.graphicrecorder.domain.AnalysisResult;
import com.phillippitts.graphicrecorder.domain.GeneratedImage;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.GenerationStatusData;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.ImageData;
import com.phillippitts.graphicrecorder.service.provider.AnalysisRequest;
import com.phillippitts.graphicrecorder.testutil.RecorderHarness;
import com.phillippitts.graphicrecorder.testutil.RecorderHarness.Client;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisCoordinatorTest {

    private RecorderHarness h;
    private Client recorder;
    private String meetingId;
    private final List<AnalysisRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        h = new RecorderHarness();
        h.analysisProperties.setWordThreshold(4);
        h.analysisProperties.setIntervalMs(60_000);
        h.analysisProperties.setCheckIntervalMs(10_000);
        h.analysisProvider = request -> {
            requests.add(request);
            return CompletableFuture.completedFuture(analysis("a whiteboard sketch"));
        };
        recorder = h.connect("s1");
        h.send(recorder, "{\"type\":\"meeting:start\",\"data\":{\"title\":\"Planning\"}}");
        meetingId = recorder.ctx().meetingId();
        h.send(recorder, "{\"type\":\"session:start\"}");
        recorder.connection().clear();
    }

    private static AnalysisResult analysis(String imagePrompt) {
        return new AnalysisResult(List.of("- roadmap agreed"), List.of("roadmap"), List.of("planning"),
                70, 40, imagePrompt);
    }

    private void say(String text) {
        h.transcription.lastOpen().listener()
                .onTranscript(new TranscriptSegment(text, h.clock.millis(), true, 0, 0.0, false));
    }

    private List<String> phases() {
        return recorder.connection().dataOf("generation:status", GenerationStatusData.class).stream()
                .map(GenerationStatusData::phase)
                .toList();
    }

    @Test
    void wordThresholdRunsFullPipeline() {
        say("we agreed on the roadmap");

        assertThat(recorder.connection().types()).containsExactly(
                "transcript", "generation:status", "analysis", "generation:status", "image", "generation:status");
        assertThat(phases()).containsExactly("analyzing", "generating", "idle");
        assertThat(requests).singleElement()
                .satisfies(request -> assertThat(request.transcript()).isEqualTo("we agreed on the roadmap"));
        assertThat(h.store.loadMeetingAnalyses(meetingId)).hasSize(1);
        assertThat(h.store.loadMeetingImages(meetingId)).hasSize(1);
        assertThat(h.registry.find("graphicrecorder.analysis.latency").tag("outcome", "success").timer())
                .isNotNull();
    }

    @Test
    void belowThresholdWaitsForInterval() {
        say("short remark");
        assertThat(requests).isEmpty();

        h.clock.advance(Duration.ofSeconds(30));
        h.timers.fireNext();
        assertThat(requests).isEmpty();

        h.clock.advance(Duration.ofSeconds(30));
        h.timers.fireNext();
        assertThat(requests).hasSize(1);
    }

    @Test
    void nothingNewMeansNoAnalysis() {
        h.clock.advance(Duration.ofMinutes(10));
        h.timers.fireNext();

        assertThat(requests).isEmpty();
        assertThat(recorder.connection().sent()).isEmpty();
    }

    @Test
    void previousTopicsFeedTheNextPass() {
        say("we agreed on the roadmap");
        say("next we talk about hiring plans");

        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).previousTopics()).containsExactly("roadmap");
        assertThat(requests.get(1).transcript()).isEqualTo("next we talk about hiring plans");
    }

    @Test
    void blankImagePromptSkipsImageGeneration() {
        h.analysisProvider = request -> CompletableFuture.completedFuture(analysis(""));

        say("we agreed on the roadmap");

        assertThat(phases()).containsExactly("analyzing", "idle");
        assertThat(recorder.connection().types()).doesNotContain("image");
    }

    @Test
    void imageRetriesAreReported() {
        h.imageProvider = (prompt, model, onRetrying) -> {
            onRetrying.accept(1);
            return CompletableFuture.completedFuture(new GeneratedImage("aW1n", prompt, h.clock.millis()));
        };

        say("we agreed on the roadmap");

        List<GenerationStatusData> statuses =
                recorder.connection().dataOf("generation:status", GenerationStatusData.class);
        assertThat(statuses).extracting(GenerationStatusData::phase)
                .containsExactly("analyzing", "generating", "retrying", "idle");
        assertThat(statuses.get(2).retryAttempt()).isEqualTo(1);
        assertThat(recorder.connection().dataOf("image", ImageData.class)).singleElement()
                .satisfies(image -> assertThat(image.prompt()).isEqualTo("a whiteboard sketch"));
    }

    @Test
    void analysisFailureIsReportedAndPipelineRecovers() {
        h.analysisProvider = request -> CompletableFuture.failedFuture(new IllegalStateException("model overloaded"));

        say("we agreed on the roadmap");

        assertThat(recorder.connection().errors()).singleElement()
                .satisfies(error -> assertThat(error.message()).isEqualTo("model overloaded"));
        assertThat(phases()).containsExactly("analyzing", "idle");
        assertThat(recorder.ctx().analysis().isInProgress()).isFalse();
    }

    @Test
    void imageFailureIsReportedButAnalysisIsKept() {
        h.imageProvider = (prompt, model, onRetrying) ->
                CompletableFuture.failedFuture(new IllegalStateException("quota exceeded"));

        say("we agreed on the roadmap");

        assertThat(recorder.connection().types()).contains("analysis");
        assertThat(recorder.connection().errors()).extracting(e -> e.message()).containsExactly("quota exceeded");
        assertThat(h.store.loadMeetingAnalyses(meetingId)).hasSize(1);
        assertThat(h.store.loadMeetingImages(meetingId)).isEmpty();
    }

    @Test
    void onlyOnePassInFlight() {
        CompletableFuture<AnalysisResult> pending = new CompletableFuture<>();
        h.analysisProvider = request -> {
            requests.add(request);
            return pending;
        };

        say("we agreed on the roadmap");
        say("and we also agreed on budgets");

        assertThat(requests).hasSize(1);
        assertThat(recorder.ctx().analysis().isInProgress()).isTrue();
    }

    @Test
    void resultArrivingAfterStopIsDiscarded() {
        CompletableFuture<AnalysisResult> pending = new CompletableFuture<>();
        h.analysisProvider = request -> pending;
        say("we agreed on the roadmap");

        h.send(recorder, "{\"type\":\"session:stop\"}");
        recorder.connection().clear();
        pending.complete(analysis("late"));

        assertThat(recorder.connection().sent()).isEmpty();
        assertThat(h.store.loadMeetingAnalyses(meetingId)).isEmpty();
    }

    @Test
    void resultsReachViewersToo() {
        Client viewer = h.connect("s2");
        h.send(viewer, "{\"type\":\"meeting:start\",\"data\":{\"meetingId\":\"" + meetingId
                + "\",\"mode\":\"view\"}}");
        viewer.connection().clear();

        say("we agreed on the roadmap");

        assertThat(viewer.connection().types()).contains("analysis", "image");
    }
}
