package com.phillippitts.graphicrecorder.service.report;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Content of {@code report.json}; {@code report.md} is rendered from the same tree.
 * Media entries point at their path inside the archive.
 */
public record MeetingReport(
        MeetingInfo meeting,
        Transcript transcript,
        Map<String, String> speakerAliases,
        Summary summary,
        Aggregates aggregates,
        Media media,
        MediaBundle mediaBundle,
        List<MissingMedia> missingMedia
) {

    public record MeetingInfo(String id, String title, long startedAt, Long endedAt, long generatedAt,
                              int sessionCount) {
    }

    public record Transcript(List<Utterance> utterances) {
    }

    /** Consecutive final segments up to an utterance end, joined with single spaces. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Utterance(long startTimestamp, long endTimestamp, Integer speaker, Double startTime, String text) {
    }

    public record Summary(AnalysisEntry latestAnalysis, List<AnalysisEntry> analyses,
                          List<MetaSummaryEntry> metaSummaries) {
    }

    public record AnalysisEntry(List<String> summary, List<String> topics, List<String> tags, int flow, int heat,
                                long timestamp) {
    }

    public record MetaSummaryEntry(long id, long startTime, long endTime, List<String> summary, List<String> themes,
                                   Long representativeImageId, long createdAt) {
    }

    public record Aggregates(List<NameCount> topics, List<NameCount> tags) {
    }

    public record NameCount(String name, int count) {
    }

    public record Media(List<ImageEntry> images, List<CaptureEntry> captures) {
    }

    public record ImageEntry(long id, long timestamp, String prompt, String file) {
    }

    public record CaptureEntry(long id, long timestamp, String file) {
    }

    public record MediaBundle(boolean includeMedia, String onMediaLimit, long maxBytes, long includedBytes,
                              String mode, BundleCounts counts) {
    }

    public record BundleCounts(KindCounts total, KindCounts included, KindCounts omitted) {
    }

    public record KindCounts(int images, int captures) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MissingMedia(String kind, long id, String expectedPath, String reason, Long bytes) {
    }
}
