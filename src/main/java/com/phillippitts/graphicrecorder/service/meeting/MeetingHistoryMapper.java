package com.phillippitts.graphicrecorder.service.meeting;

import com.phillippitts.graphicrecorder.domain.AnalysisRecord;
import com.phillippitts.graphicrecorder.domain.AnalysisResult;
import com.phillippitts.graphicrecorder.domain.CaptureRecord;
import com.phillippitts.graphicrecorder.domain.ImageRecord;
import com.phillippitts.graphicrecorder.domain.MetaSummary;
import com.phillippitts.graphicrecorder.domain.SpeakerAlias;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.HistoryAnalysis;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.HistoryCapture;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.HistoryImage;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.HistoryMetaSummary;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.HistoryTranscript;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.MeetingHistoryData;
import com.phillippitts.graphicrecorder.service.persistence.MeetingStore;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a meeting's stored history into the {@code meeting:history} payload shape.
 * Media is referenced by URL; payload bytes are served by the media endpoints.
 */
@Component
public class MeetingHistoryMapper {

    private final MeetingStore store;

    public MeetingHistoryMapper(MeetingStore store) {
        this.store = store;
    }

    public MeetingHistoryData full(String meetingId) {
        return since(meetingId, HistoryCursor.EMPTY);
    }

    /** Items strictly newer than each cursor field; meta-summaries compare by end time. */
    public MeetingHistoryData since(String meetingId, HistoryCursor cursor) {
        List<HistoryTranscript> transcripts = store.loadMeetingTranscript(meetingId).stream()
                .filter(segment -> HistoryCursor.isNewer(segment.timestamp(), cursor.transcriptTs()))
                .map(MeetingHistoryMapper::toHistory)
                .toList();
        List<HistoryAnalysis> analyses = store.loadMeetingAnalyses(meetingId).stream()
                .filter(analysis -> HistoryCursor.isNewer(analysis.timestamp(), cursor.analysisTs()))
                .map(MeetingHistoryMapper::toHistory)
                .toList();
        List<HistoryImage> images = store.loadMeetingImages(meetingId).stream()
                .filter(image -> HistoryCursor.isNewer(image.timestamp(), cursor.imageTs()))
                .map(image -> toHistory(meetingId, image))
                .toList();
        List<HistoryCapture> captures = store.loadMeetingCaptures(meetingId).stream()
                .filter(capture -> HistoryCursor.isNewer(capture.timestamp(), cursor.captureTs()))
                .map(capture -> toHistory(meetingId, capture))
                .toList();
        List<HistoryMetaSummary> metaSummaries = store.loadMetaSummaries(meetingId).stream()
                .filter(summary -> HistoryCursor.isNewer(summary.endTime(), cursor.metaSummaryEndTs()))
                .map(MeetingHistoryMapper::toHistory)
                .toList();
        return new MeetingHistoryData(meetingId, transcripts, analyses, images, captures, metaSummaries,
                speakerAliases(meetingId));
    }

    public Map<String, String> speakerAliases(String meetingId) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (SpeakerAlias alias : store.loadSpeakerAliases(meetingId)) {
            aliases.put(String.valueOf(alias.speaker()), alias.displayName());
        }
        return aliases;
    }

    public static String imageUrl(String meetingId, long imageId) {
        return "/api/meetings/" + meetingId + "/images/" + imageId;
    }

    public static String captureUrl(String meetingId, long captureId) {
        return "/api/meetings/" + meetingId + "/captures/" + captureId;
    }

    private static HistoryTranscript toHistory(TranscriptSegment segment) {
        return new HistoryTranscript(segment.text(), segment.timestamp(), segment.isFinal(), segment.speaker(),
                segment.startTime(), segment.utteranceEnd() ? Boolean.TRUE : null);
    }

    private static HistoryAnalysis toHistory(AnalysisRecord record) {
        AnalysisResult result = record.result();
        return new HistoryAnalysis(result.summary(), result.topics(), result.tags(), result.flow(), result.heat(),
                record.timestamp());
    }

    private static HistoryImage toHistory(String meetingId, ImageRecord image) {
        return new HistoryImage(imageUrl(meetingId, image.id()), image.prompt(), image.timestamp());
    }

    private static HistoryCapture toHistory(String meetingId, CaptureRecord capture) {
        return new HistoryCapture(captureUrl(meetingId, capture.id()), capture.timestamp());
    }

    private static HistoryMetaSummary toHistory(MetaSummary summary) {
        return new HistoryMetaSummary(summary.summary(), summary.themes(), summary.startTime(), summary.endTime());
    }
}
