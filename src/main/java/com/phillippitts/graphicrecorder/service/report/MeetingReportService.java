package com.phillippitts.graphicrecorder.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.graphicrecorder.config.properties.ReportProperties;
import com.phillippitts.graphicrecorder.domain.AnalysisRecord;
import com.phillippitts.graphicrecorder.domain.CaptureRecord;
import com.phillippitts.graphicrecorder.domain.ImageRecord;
import com.phillippitts.graphicrecorder.domain.Meeting;
import com.phillippitts.graphicrecorder.domain.SpeakerAlias;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.exception.StorageException;
import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.service.persistence.MeetingStore;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.AnalysisEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.BundleCounts;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.CaptureEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.ImageEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.KindCounts;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.MediaBundle;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.MetaSummaryEntry;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.MissingMedia;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.NameCount;
import com.phillippitts.graphicrecorder.service.report.MeetingReport.Utterance;
import com.phillippitts.graphicrecorder.service.report.ReportOptions.MediaLimitPolicy;
import com.phillippitts.graphicrecorder.util.Ids;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds {@code report.zip} for a meeting: {@code report.md}, {@code report.json},
 * {@code media/README.md} and, unless disabled, the generated images (and on request the
 * camera captures) under {@code media/}.
 *
 * <p>Media is added in time order until {@link ReportProperties#getMaxMediaBytes()} would be
 * exceeded. Under {@link MediaLimitPolicy#SKIP} the rest is listed in {@code missingMedia};
 * under {@link MediaLimitPolicy#ERROR} the export is refused.
 */
@Service
public class MeetingReportService {

    private static final Logger LOG = LogManager.getLogger(MeetingReportService.class);

    static final String REASON_DISABLED = "disabled";
    static final String REASON_NOT_FOUND = "notFound";
    static final String REASON_SIZE_LIMIT = "sizeLimit";

    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\x00-\\x1F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_TITLE_CHARS = 80;

    private final MeetingStore store;
    private final ObjectMapper mapper;
    private final ReportProperties properties;
    private final RecordingMetrics metrics;
    private final Clock clock;

    public MeetingReportService(MeetingStore store, ObjectMapper mapper, ReportProperties properties,
                                RecordingMetrics metrics, Clock clock) {
        this.store = store;
        this.mapper = mapper;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws DomainException {@code REPORT_TOO_LARGE} when media exceeds the budget under
     *                         {@link MediaLimitPolicy#ERROR}
     */
    public ReportArchive export(String meetingId, ReportOptions options) {
        Meeting meeting = requireMeeting(meetingId);
        long now = clock.millis();

        List<MediaItem> items = new ArrayList<>();
        List<ImageEntry> images = new ArrayList<>();
        for (ImageRecord image : store.loadMeetingImages(meetingId)) {
            String file = "media/images/" + image.id() + extensionOf(image.storageKey(), ".png");
            images.add(new ImageEntry(image.id(), image.timestamp(), image.prompt(), file));
            items.add(new MediaItem("image", image.id(), image.storageKey(), file));
        }
        List<CaptureEntry> captures = new ArrayList<>();
        if (options.includeCaptures()) {
            for (CaptureRecord capture : store.loadMeetingCaptures(meetingId)) {
                String file = "media/captures/" + capture.id() + extensionOf(capture.storageKey(), ".jpg");
                captures.add(new CaptureEntry(capture.id(), capture.timestamp(), file));
                items.add(new MediaItem("capture", capture.id(), capture.storageKey(), file));
            }
        }

        Bundle bundle = collectMedia(meetingId, items, options);
        MeetingReport report = buildReport(meeting, now, images, captures, bundle, options);

        ReportMarkdown markdown = new ReportMarkdown(properties.zoneId());
        byte[] archive = zip(markdown.render(report), toJson(report), markdown.renderMediaReadme(report),
                bundle.included());
        String filename = archiveName(now, meeting.title());
        LOG.info("Report built (meeting={}, bytes={}, mediaMode={})",
                meetingId, archive.length, report.mediaBundle().mode());
        return new ReportArchive(filename, archive, report.mediaBundle().mode());
    }

    private Bundle collectMedia(String meetingId, List<MediaItem> items, ReportOptions options) {
        long maxBytes = properties.getMaxMediaBytes();
        long includedBytes = 0;
        List<IncludedMedia> included = new ArrayList<>();
        List<MissingMedia> missing = new ArrayList<>();
        for (MediaItem item : items) {
            if (!options.includeMedia()) {
                missing.add(new MissingMedia(item.kind(), item.id(), item.file(), REASON_DISABLED, null));
                continue;
            }
            byte[] content;
            try {
                content = Base64.getDecoder().decode(store.loadMediaBase64(item.storageKey()));
            } catch (StorageException | IllegalArgumentException e) {
                LOG.warn("Report media unreadable (meeting={}, {} id={}): {}",
                        meetingId, item.kind(), item.id(), e.getMessage());
                missing.add(new MissingMedia(item.kind(), item.id(), item.file(), REASON_NOT_FOUND, null));
                continue;
            }
            long nextTotal = includedBytes + content.length;
            if (nextTotal > maxBytes) {
                if (options.onMediaLimit() == MediaLimitPolicy.ERROR) {
                    LOG.warn("Report too large (meeting={}, bytes={}, max={})", meetingId, nextTotal, maxBytes);
                    metrics.incrementReportRejected("size-limit");
                    throw new DomainException(ErrorCode.REPORT_TOO_LARGE, "Report too large to bundle media");
                }
                missing.add(new MissingMedia(item.kind(), item.id(), item.file(), REASON_SIZE_LIMIT,
                        (long) content.length));
                continue;
            }
            includedBytes = nextTotal;
            included.add(new IncludedMedia(item, content));
        }
        return new Bundle(included, missing, includedBytes);
    }

    private MeetingReport buildReport(Meeting meeting, long now, List<ImageEntry> images, List<CaptureEntry> captures,
                                      Bundle bundle, ReportOptions options) {
        String meetingId = meeting.id();
        List<AnalysisEntry> analyses = store.loadMeetingAnalyses(meetingId).stream()
                .map(MeetingReportService::toEntry)
                .toList();
        AnalysisEntry latest = analyses.isEmpty() ? null : analyses.get(analyses.size() - 1);
        List<MetaSummaryEntry> metaSummaries = store.loadMetaSummaries(meetingId).stream()
                .map(m -> new MetaSummaryEntry(m.id(), m.startTime(), m.endTime(), m.summary(),
                        m.themes().stream().filter(Objects::nonNull).toList(),
                        m.representativeImageId(), m.createdAt()))
                .toList();

        Map<String, String> aliases = new LinkedHashMap<>();
        for (SpeakerAlias alias : store.loadSpeakerAliases(meetingId)) {
            if (!alias.displayName().isBlank()) {
                aliases.put(String.valueOf(alias.speaker()), alias.displayName().trim());
            }
        }

        MeetingReport.Aggregates aggregates = new MeetingReport.Aggregates(
                countByName(analyses.stream().flatMap(a -> a.topics().stream()).toList()),
                countByName(analyses.stream().flatMap(a -> a.tags().stream()).toList()));

        return new MeetingReport(
                new MeetingReport.MeetingInfo(meetingId, meeting.title(), meeting.startedAt(), meeting.endedAt(),
                        now, store.loadMeetingSessions(meetingId).size()),
                new MeetingReport.Transcript(buildUtterances(store.loadMeetingTranscript(meetingId))),
                aliases,
                new MeetingReport.Summary(latest, analyses, metaSummaries),
                aggregates,
                new MeetingReport.Media(images, captures),
                mediaBundle(images.size(), captures.size(), bundle, options),
                bundle.missing());
    }

    private MediaBundle mediaBundle(int imageCount, int captureCount, Bundle bundle, ReportOptions options) {
        int includedImages = (int) bundle.included().stream().filter(m -> m.item().kind().equals("image")).count();
        int includedCaptures = bundle.included().size() - includedImages;
        int total = imageCount + captureCount;
        String mode;
        if (total == 0 || bundle.included().size() == total) {
            mode = "all";
        } else if (bundle.included().isEmpty()) {
            mode = "none";
        } else {
            mode = "partial";
        }
        BundleCounts counts = new BundleCounts(
                new KindCounts(imageCount, captureCount),
                new KindCounts(includedImages, includedCaptures),
                new KindCounts(imageCount - includedImages, captureCount - includedCaptures));
        return new MediaBundle(options.includeMedia(), options.onMediaLimit().wire(), properties.getMaxMediaBytes(),
                bundle.includedBytes(), mode, counts);
    }

    /** Groups final segments into utterances, closing one at each utterance-end flag. */
    static List<Utterance> buildUtterances(List<TranscriptSegment> transcript) {
        List<Utterance> utterances = new ArrayList<>();
        List<TranscriptSegment> buffer = new ArrayList<>();
        for (TranscriptSegment segment : transcript) {
            if (!segment.isFinal()) {
                continue;
            }
            buffer.add(segment);
            if (segment.utteranceEnd()) {
                flush(buffer, utterances);
            }
        }
        flush(buffer, utterances);
        return utterances;
    }

    private static void flush(List<TranscriptSegment> buffer, List<Utterance> utterances) {
        if (buffer.isEmpty()) {
            return;
        }
        String text = buffer.stream()
                .map(s -> s.text().trim())
                .filter(t -> !t.isEmpty())
                .collect(Collectors.joining(" "));
        if (!text.isEmpty()) {
            TranscriptSegment first = buffer.get(0);
            TranscriptSegment last = buffer.get(buffer.size() - 1);
            utterances.add(new Utterance(first.timestamp(), last.timestamp(), first.speaker(), first.startTime(), text));
        }
        buffer.clear();
    }

    /** Most frequent first, ties by name. */
    static List<NameCount> countByName(List<String> names) {
        Map<String, Long> counts = names.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> new NameCount(e.getKey(), e.getValue().intValue()))
                .sorted(Comparator.comparingInt(NameCount::count).reversed().thenComparing(NameCount::name))
                .toList();
    }

    /** {@code yyyyMMdd-HHmm-<title>-report.zip}, with the title made safe for common filesystems. */
    String archiveName(long now, String title) {
        String stamp = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm")
                .withZone(properties.zoneId())
                .format(Instant.ofEpochMilli(now));
        String safe = UNSAFE_FILENAME_CHARS.matcher(title == null ? "Untitled Meeting" : title).replaceAll("_");
        safe = WHITESPACE.matcher(safe).replaceAll(" ").trim();
        if (safe.length() > MAX_TITLE_CHARS) {
            safe = safe.substring(0, MAX_TITLE_CHARS);
        }
        return stamp + "-" + (safe.isEmpty() ? "untitled" : safe) + "-report.zip";
    }

    private String toJson(MeetingReport report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report could not be serialized", e);
        }
    }

    private static byte[] zip(String reportMd, String reportJson, String mediaReadme, List<IncludedMedia> media) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            putEntry(zip, "report.md", reportMd.getBytes(StandardCharsets.UTF_8));
            putEntry(zip, "report.json", reportJson.getBytes(StandardCharsets.UTF_8));
            putEntry(zip, "media/README.md", mediaReadme.getBytes(StandardCharsets.UTF_8));
            for (IncludedMedia included : media) {
                putEntry(zip, included.item().file(), included.content());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Report archive could not be written", e);
        }
        return out.toByteArray();
    }

    private static void putEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }

    private Meeting requireMeeting(String meetingId) {
        if (!Ids.isValidMeetingId(meetingId)) {
            throw new DomainException(ErrorCode.INVALID_MEETING_ID, "Invalid meeting ID format");
        }
        return store.findMeeting(meetingId)
                .orElseThrow(() -> new DomainException(ErrorCode.MEETING_NOT_FOUND, "Meeting not found"));
    }

    private static AnalysisEntry toEntry(AnalysisRecord record) {
        return new AnalysisEntry(record.result().summary(), record.result().topics(), record.result().tags(),
                record.result().flow(), record.result().heat(), record.timestamp());
    }

    private static String extensionOf(String storageKey, String fallback) {
        String lower = storageKey.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".jpeg") || lower.endsWith(".jpg")) {
            return ".jpg";
        }
        if (lower.endsWith(".png") || lower.endsWith(".webp")) {
            return lower.substring(lower.lastIndexOf('.'));
        }
        return fallback;
    }

    private record MediaItem(String kind, long id, String storageKey, String file) {
    }

    private record IncludedMedia(MediaItem item, byte[] content) {
    }

    private record Bundle(List<IncludedMedia> included, List<MissingMedia> missing, long includedBytes) {
    }
}
