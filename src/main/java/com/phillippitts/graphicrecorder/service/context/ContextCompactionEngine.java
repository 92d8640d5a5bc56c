package com.phillippitts.graphicrecorder.service.context;

import com.phillippitts.graphicrecorder.config.properties.ContextProperties;
import com.phillippitts.graphicrecorder.domain.AnalysisRecord;
import com.phillippitts.graphicrecorder.domain.CameraFrame;
import com.phillippitts.graphicrecorder.domain.ImageRecord;
import com.phillippitts.graphicrecorder.domain.MetaSummary;
import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.service.persistence.MeetingStore;
import com.phillippitts.graphicrecorder.service.provider.MetaSummarizer;
import com.phillippitts.graphicrecorder.service.provider.Providers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Builds the tiered analysis context and decides when to compact analyses into a new
 * meta-summary.
 *
 * <p><b>Compaction gate:</b> at least {@code sessionThreshold} analyses since the end of
 * the last meta-summary (or since the meeting started), and either no meta-summary yet or
 * at least {@code intervalMs} elapsed since the last one ended. Each compaction covers
 * exactly the analyses strictly after the previous meta-summary, so intervals never
 * overlap and history is never rewritten.
 *
 * <p>Compaction is single-flight per meeting: a check that arrives while one is running
 * for the same meeting is skipped.
 */
@Component
public class ContextCompactionEngine {

    private static final Logger LOG = LogManager.getLogger(ContextCompactionEngine.class);

    private final MeetingStore store;
    private final ContextProperties properties;
    private final MetaSummarizer summarizer;
    private final Executor io;
    private final Clock clock;
    private final RecordingMetrics metrics;

    private final Set<String> compacting = ConcurrentHashMap.newKeySet();

    public ContextCompactionEngine(MeetingStore store,
                                   ContextProperties properties,
                                   Providers providers,
                                   @Qualifier("persistenceExecutor") Executor io,
                                   Clock clock,
                                   RecordingMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.summarizer = providers.metaSummarizer();
        this.io = Objects.requireNonNull(io, "io");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics;
    }

    /**
     * Assembles the context for one analysis pass. Image payloads load independently; an
     * image that fails to load is left out instead of failing the build.
     *
     * @param meetingId    meeting to draw history from; null yields a transcript-only context
     * @param transcript   transcript text to analyze
     * @param cameraFrames frames captured in the current session
     */
    public CompletableFuture<HierarchicalContext> buildContext(String meetingId, String transcript,
                                                               List<CameraFrame> cameraFrames) {
        List<CameraFrame> frames = List.copyOf(cameraFrames);
        if (meetingId == null) {
            return CompletableFuture.completedFuture(HierarchicalContext.transcriptOnly(transcript, frames));
        }
        return CompletableFuture.supplyAsync(() -> loadTiers(meetingId), io)
                .thenCompose(tiers -> loadImages(tiers.images())
                        .thenApply(images -> new HierarchicalContext(
                                transcript,
                                tiers.analyses(),
                                images,
                                frames,
                                tiers.metaSummaries(),
                                extractThemes(tiers.metaSummaries()))));
    }

    /**
     * Distinct, trimmed, non-blank themes across the given meta-summaries, in order of first
     * appearance. Null and whitespace-only entries are dropped.
     */
    public static List<String> extractThemes(List<MetaSummary> metaSummaries) {
        Set<String> themes = new LinkedHashSet<>();
        for (MetaSummary metaSummary : metaSummaries) {
            if (metaSummary == null) {
                continue;
            }
            for (String theme : metaSummary.themes()) {
                if (theme == null) {
                    continue;
                }
                String trimmed = theme.trim();
                if (!trimmed.isEmpty()) {
                    themes.add(trimmed);
                }
            }
        }
        return List.copyOf(themes);
    }

    /**
     * Evaluates the compaction gate for {@code meetingId} at the current clock time.
     */
    public boolean shouldTriggerMetaSummary(String meetingId) {
        Optional<MetaSummary> latest = store.findLatestMetaSummary(meetingId);
        Long lastEnd = latest.map(MetaSummary::endTime).orElse(null);
        int pending = store.loadMeetingAnalysesAfter(meetingId, lastEnd).size();
        ContextProperties.MetaSummary gate = properties.getMetaSummary();
        if (pending < gate.getSessionThreshold()) {
            return false;
        }
        if (lastEnd == null) {
            return true;
        }
        return clock.millis() - lastEnd >= gate.getIntervalMs();
    }

    /**
     * Collects the analyses not yet covered by a meta-summary, plus the images generated in
     * the same span as representative-image candidates.
     */
    public Optional<MetaSummaryInput> prepareInput(String meetingId) {
        Long lastEnd = store.findLatestMetaSummary(meetingId).map(MetaSummary::endTime).orElse(null);
        List<AnalysisRecord> analyses = store.loadMeetingAnalysesAfter(meetingId, lastEnd);
        if (analyses.isEmpty()) {
            return Optional.empty();
        }
        long start = analyses.get(0).timestamp();
        long end = analyses.get(analyses.size() - 1).timestamp();
        List<ImageRecord> images = store.loadMeetingImages(meetingId).stream()
                .filter(image -> (lastEnd == null || image.timestamp() > lastEnd) && image.timestamp() <= end)
                .toList();
        return Optional.of(new MetaSummaryInput(meetingId, start, end, analyses, images));
    }

    /**
     * Synthesizes and persists one meta-summary over the uncovered analyses, regardless of
     * the gate. Completes with empty when there is nothing to compact.
     */
    public CompletableFuture<Optional<MetaSummary>> compact(String meetingId) {
        Optional<MetaSummaryInput> prepared = prepareInput(meetingId);
        if (prepared.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        MetaSummaryInput input = prepared.get();
        LOG.info("Compacting {} analyses into a meta-summary (meeting={})", input.analyses().size(), meetingId);
        return summarizer.summarize(input).thenApply(content -> {
            MetaSummary saved = store.persistMetaSummary(meetingId, input.startTime(), input.endTime(),
                    content.summary(), content.themes(), representativeImage(input, content));
            metrics.incrementMetaSummary();
            LOG.info("Meta-summary stored (meeting={}, id={}, span={}..{})",
                    meetingId, saved.id(), saved.startTime(), saved.endTime());
            return Optional.of(saved);
        });
    }

    /**
     * Compacts when the gate is open. Best-effort: failures are logged and complete with
     * empty, never exceptionally.
     */
    public CompletableFuture<Optional<MetaSummary>> checkAndCompact(String meetingId) {
        if (!compacting.add(meetingId)) {
            LOG.debug("Compaction already running (meeting={})", meetingId);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CompletableFuture<Optional<MetaSummary>> result;
        try {
            result = shouldTriggerMetaSummary(meetingId)
                    ? compact(meetingId)
                    : CompletableFuture.completedFuture(Optional.empty());
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.handle((summary, error) -> {
            compacting.remove(meetingId);
            if (error != null) {
                LOG.warn("Meta-summary compaction failed (meeting={}): {}", meetingId, error.getMessage());
                return Optional.<MetaSummary>empty();
            }
            return summary;
        });
    }

    private Tiers loadTiers(String meetingId) {
        List<AnalysisRecord> analyses = properties.getRecentAnalysesCount() > 0
                ? store.loadRecentMeetingAnalyses(meetingId, properties.getRecentAnalysesCount())
                : List.of();
        List<ImageRecord> images = properties.getRecentImagesCount() > 0
                ? store.loadRecentMeetingImages(meetingId, properties.getRecentImagesCount())
                : List.of();
        return new Tiers(analyses, images, store.loadMetaSummaries(meetingId));
    }

    private CompletableFuture<List<RecentImage>> loadImages(List<ImageRecord> records) {
        List<CompletableFuture<RecentImage>> loads = new ArrayList<>(records.size());
        for (ImageRecord record : records) {
            loads.add(CompletableFuture
                    .supplyAsync(() -> new RecentImage(record.id(), store.loadMediaBase64(record.storageKey()),
                            record.prompt(), record.timestamp()), io)
                    .handle((image, error) -> {
                        if (error != null) {
                            LOG.warn("Skipping context image {}: {}", record.id(), error.getMessage());
                            return null;
                        }
                        return image;
                    }));
        }
        return CompletableFuture.allOf(loads.toArray(new CompletableFuture<?>[0]))
                .thenApply(done -> {
                    List<RecentImage> loaded = new ArrayList<>(loads.size());
                    for (CompletableFuture<RecentImage> load : loads) {
                        RecentImage image = load.join();
                        if (image != null) {
                            loaded.add(image);
                        }
                    }
                    return loaded;
                });
    }

    private static Long representativeImage(MetaSummaryInput input, MetaSummaryContent content) {
        Long candidate = content.representativeImageId();
        if (candidate == null) {
            return null;
        }
        boolean known = input.images().stream().anyMatch(image -> image.id() == candidate);
        return known ? candidate : null;
    }

    private record Tiers(List<AnalysisRecord> analyses, List<ImageRecord> images, List<MetaSummary> metaSummaries) {
    }
}
