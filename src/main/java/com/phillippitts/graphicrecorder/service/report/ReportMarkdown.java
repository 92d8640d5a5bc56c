package com.phillippitts.graphicrecorder.service.report;

import com.phillippitts.graphicrecorder.service.report.MeetingReport.AnalysisEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.CaptureEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.ImageEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.MetaSummaryEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.MissingMedia;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.NameCount;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.Utterance;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders {@code report.md} and {@code media/README.md} from a {@link MeetingReport}.
 * Image links are relative to the archive root.
 */
final class ReportMarkdown {

    private static final String NONE = "- (none)";
    private static final int TOP_AGGREGATES = 10;

    private final DateTimeFormatter dateTime;

    ReportMarkdown(ZoneId zone) {
        this.dateTime = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm").withZone(zone);
    }

    String render(MeetingReport report) {
        List<String> lines = new ArrayList<>();
        String title = report.meeting().title() == null || report.meeting().title().isBlank()
                ? "Untitled Meeting"
                : report.meeting().title().trim();

        lines.add("# " + title);
        lines.add("");
        lines.add("- meetingId: `" + report.meeting().id() + "`");
        lines.add("- Generated: " + format(report.meeting().generatedAt()));
        Long endedAt = report.meeting().endedAt();
        lines.add("- Started: " + format(report.meeting().startedAt())
                + " / Ended: " + (endedAt == null ? "(not ended)" : format(endedAt)));
        lines.add("- Sessions: " + report.meeting().sessionCount());
        lines.add("");

        if (!"all".equals(report.mediaBundle().mode())) {
            lines.add("## Media bundle");
            lines.add("");
            if (!report.mediaBundle().includeMedia()) {
                lines.add("- Media is not included.");
            } else {
                lines.add("- Some media may be left out because of the size limit ("
                        + report.mediaBundle().maxBytes() + " bytes).");
                lines.add("- Included: " + report.mediaBundle().includedBytes() + " bytes");
            }
            lines.add("");
        }

        renderHighlights(report, lines);
        renderAggregates(report, lines);
        renderTimeline(report, lines);
        renderTranscript(report, lines);
        renderImages(report, lines);
        renderCaptures(report, lines);

        if (!report.missingMedia().isEmpty()) {
            lines.add("## Missing media");
            lines.add("");
            for (MissingMedia missing : report.missingMedia()) {
                lines.add("- " + missing.kind() + " id=" + missing.id() + ": " + missing.expectedPath()
                        + " (" + reasonLabel(missing.reason()) + ")");
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }

    String renderMediaReadme(MeetingReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("# About media");
        lines.add("");
        lines.add("- `report.md` links to paths inside this archive, such as `media/images/...`.");
        lines.add("- When media is left out, `missingMedia` in `report.json` says which and why.");
        lines.add("");
        lines.add("## Bundle policy");
        lines.add("");
        lines.add("- includeMedia: " + report.mediaBundle().includeMedia());
        lines.add("- onMediaLimit: " + report.mediaBundle().onMediaLimit());
        lines.add("- maxBytes: " + report.mediaBundle().maxBytes());
        lines.add("- includedBytes: " + report.mediaBundle().includedBytes());
        lines.add("- mode: " + report.mediaBundle().mode());
        lines.add("");
        lines.add("## Files");
        lines.add("");
        lines.add("- images: " + report.media().images().size());
        if (!report.media().captures().isEmpty()) {
            lines.add("- captures: " + report.media().captures().size());
        }
        if (!"all".equals(report.mediaBundle().mode())) {
            lines.add("");
            lines.add("## Note");
            lines.add("");
            lines.add("- Not every media file is included, because of size or missing files.");
        }
        return String.join("\n", lines);
    }

    private void renderHighlights(MeetingReport report, List<String> lines) {
        lines.add("## Highlights");
        lines.add("");
        List<MetaSummaryEntry> metas = report.summary().metaSummaries();
        MetaSummaryEntry meta = metas.isEmpty() ? null : metas.get(metas.size() - 1);
        AnalysisEntry latest = report.summary().latestAnalysis();
        if (meta != null && !meta.summary().isEmpty()) {
            meta.summary().forEach(point -> lines.add("- " + point));
            if (!meta.themes().isEmpty()) {
                lines.add("");
                lines.add("Themes: " + String.join(", ", meta.themes()));
            }
        } else if (latest != null && !latest.summary().isEmpty()) {
            latest.summary().forEach(point -> lines.add("- " + point));
        } else {
            lines.add("- (no summary yet)");
        }
        lines.add("");
    }

    private void renderAggregates(MeetingReport report, List<String> lines) {
        lines.add("## Topics / tags");
        lines.add("");
        lines.add("### Topics");
        addCounts(report.aggregates().topics(), lines);
        lines.add("");
        lines.add("### Tags");
        addCounts(report.aggregates().tags(), lines);
        lines.add("");
    }

    private static void addCounts(List<NameCount> counts, List<String> lines) {
        if (counts.isEmpty()) {
            lines.add(NONE);
            return;
        }
        counts.stream().limit(TOP_AGGREGATES).forEach(c -> lines.add("- " + c.name() + " (" + c.count() + ")"));
    }

    private void renderTimeline(MeetingReport report, List<String> lines) {
        lines.add("## Summary timeline");
        lines.add("");
        if (report.summary().analyses().isEmpty()) {
            lines.add(NONE);
        }
        for (AnalysisEntry analysis : report.summary().analyses()) {
            lines.add("### " + format(analysis.timestamp()));
            analysis.summary().forEach(point -> lines.add("- " + point));
            if (!analysis.topics().isEmpty()) {
                lines.add("- topics: " + String.join(", ", analysis.topics()));
            }
            if (!analysis.tags().isEmpty()) {
                lines.add("- tags: " + String.join(", ", analysis.tags()));
            }
            lines.add("- flow: " + analysis.flow() + " / heat: " + analysis.heat());
            lines.add("");
        }
        lines.add("");
    }

    private void renderTranscript(MeetingReport report, List<String> lines) {
        lines.add("## Transcript");
        lines.add("");
        if (report.transcript().utterances().isEmpty()) {
            lines.add(NONE);
        }
        for (Utterance utterance : report.transcript().utterances()) {
            lines.add("- **" + speakerLabel(utterance.speaker(), report.speakerAliases()) + "** ("
                    + format(utterance.startTimestamp()) + "): " + utterance.text());
        }
        lines.add("");
    }

    private void renderImages(MeetingReport report, List<String> lines) {
        lines.add("## Generated images");
        lines.add("");
        if (report.media().images().isEmpty()) {
            lines.add(NONE);
        }
        for (ImageEntry image : report.media().images()) {
            lines.add("### " + format(image.timestamp()) + " / id=" + image.id());
            lines.add("");
            lines.add("- prompt: " + image.prompt());
            Optional<String> reason = missingReason(report, "image", image.id());
            if (reason.isPresent()) {
                lines.add("- (not included: " + reasonLabel(reason.get()) + ")");
                lines.add("");
                continue;
            }
            lines.add("");
            lines.add("![](" + image.file() + ")");
            lines.add("");
        }
        lines.add("");
    }

    private void renderCaptures(MeetingReport report, List<String> lines) {
        if (report.media().captures().isEmpty()) {
            return;
        }
        lines.add("## Captures");
        lines.add("");
        for (CaptureEntry capture : report.media().captures()) {
            lines.add("### " + format(capture.timestamp()) + " / id=" + capture.id());
            lines.add("");
            Optional<String> reason = missingReason(report, "capture", capture.id());
            if (reason.isPresent()) {
                lines.add("- (not included: " + reasonLabel(reason.get()) + ")");
                lines.add("");
                continue;
            }
            lines.add("![](" + capture.file() + ")");
            lines.add("");
        }
        lines.add("");
    }

    static String speakerLabel(Integer speaker, Map<String, String> aliases) {
        if (speaker == null) {
            return "Speaker ?";
        }
        String alias = aliases.get(String.valueOf(speaker));
        if (alias != null && !alias.isBlank()) {
            return alias.trim();
        }
        return "Speaker " + (speaker + 1);
    }

    private static Optional<String> missingReason(MeetingReport report, String kind, long id) {
        return report.missingMedia().stream()
                .filter(m -> m.kind().equals(kind) && m.id() == id)
                .map(MissingMedia::reason)
                .findFirst();
    }

    private static String reasonLabel(String reason) {
        return switch (reason) {
            case MeetingReportService.REASON_DISABLED -> "left out by request";
            case MeetingReportService.REASON_SIZE_LIMIT -> "over the size limit";
            default -> "file not found";
        };
    }

    private String format(long epochMillis) {
        return dateTime.format(Instant.ofEpochMilli(epochMillis));
    }
}
