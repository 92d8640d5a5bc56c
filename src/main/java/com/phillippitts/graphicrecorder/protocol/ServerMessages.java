package com.phillippitts.graphicrecorder.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.graphicrecorder.domain.AnalysisResult;
import com.phillippitts.graphicrecorder.domain.GeneratedImage;
import com.phillippitts.graphicrecorder.domain.GenerationPhase;
import com.phillippitts.graphicrecorder.domain.Meeting;
import com.phillippitts.graphicrecorder.domain.MeetingMode;
import com.phillippitts.graphicrecorder.domain.SessionStatus;
import com.phillippitts.graphicrecorder.domain.SttState;
import com.phillippitts.graphicrecorder.domain.TranscriptSegment;
import com.phillippitts.graphicrecorder.exception.ErrorCode;

import java.util.List;
import java.util.Map;

/**
 * Factory for every server-to-client frame, and the payload shapes they serialize to.
 */
public final class ServerMessages {

    private ServerMessages() {}

    public static ServerMessage sessionStatus(SessionStatus status, String error) {
        return new ServerMessage(MessageTypes.SESSION_STATUS, new SessionStatusData(status.wire(), error));
    }

    public static ServerMessage transcript(TranscriptSegment segment) {
        return new ServerMessage(MessageTypes.TRANSCRIPT, new TranscriptData(segment.text(), segment.isFinal(),
                segment.timestamp(), segment.speaker(), segment.startTime()));
    }

    public static ServerMessage analysis(AnalysisResult result) {
        return new ServerMessage(MessageTypes.ANALYSIS, new AnalysisData(result.summary(), result.topics(),
                result.tags(), result.flow(), result.heat()));
    }

    public static ServerMessage image(GeneratedImage image) {
        return new ServerMessage(MessageTypes.IMAGE, new ImageData(image.base64(), null, image.prompt(), image.timestamp()));
    }

    public static ServerMessage generationStatus(GenerationPhase phase, Integer retryAttempt) {
        return new ServerMessage(MessageTypes.GENERATION_STATUS, new GenerationStatusData(phase.wire(), retryAttempt));
    }

    public static ServerMessage utteranceEnd(long timestamp) {
        return new ServerMessage(MessageTypes.UTTERANCE_END, new UtteranceEndData(timestamp));
    }

    public static ServerMessage sttStatus(SttState state, Integer retryAttempt, String message) {
        return new ServerMessage(MessageTypes.STT_STATUS, new SttStatusData(state.wire(), retryAttempt, message));
    }

    public static ServerMessage meetingStatus(String meetingId, String title, String sessionId, MeetingMode mode) {
        return new ServerMessage(MessageTypes.MEETING_STATUS, new MeetingStatusData(meetingId, title, sessionId, mode.wire()));
    }

    public static ServerMessage meetingList(List<Meeting> meetings) {
        List<MeetingInfo> infos = meetings.stream()
                .map(m -> new MeetingInfo(m.id(), m.title(), m.startedAt(), m.endedAt(), m.createdAt()))
                .toList();
        return new ServerMessage(MessageTypes.MEETING_LIST, new MeetingListData(infos));
    }

    public static ServerMessage meetingHistory(MeetingHistoryData history) {
        return new ServerMessage(MessageTypes.MEETING_HISTORY, history);
    }

    public static ServerMessage meetingHistoryDelta(MeetingHistoryData delta) {
        return new ServerMessage(MessageTypes.MEETING_HISTORY_DELTA, delta);
    }

    public static ServerMessage speakerAliases(Map<String, String> aliases) {
        return new ServerMessage(MessageTypes.MEETING_SPEAKER_ALIAS, new SpeakerAliasData(aliases));
    }

    public static ServerMessage imageModelStatus(String preset, String model, boolean available) {
        return new ServerMessage(MessageTypes.IMAGE_MODEL_STATUS, new ImageModelStatusData(preset, model, available));
    }

    public static ServerMessage error(String message, ErrorCode code) {
        return new ServerMessage(MessageTypes.ERROR, new ErrorData(message, code == null ? null : code.name()));
    }

    // --- payloads ---

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SessionStatusData(String status, String error) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TranscriptData(
            String text,
            @JsonProperty("isFinal") boolean isFinal,
            long timestamp,
            Integer speaker,
            Double startTime) {
    }

    public record AnalysisData(List<String> summary, List<String> topics, List<String> tags, int flow, int heat) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ImageData(String base64, String url, String prompt, long timestamp) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GenerationStatusData(String phase, Integer retryAttempt) {
    }

    public record UtteranceEndData(long timestamp) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SttStatusData(String state, Integer retryAttempt, String message) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MeetingStatusData(String meetingId, String title, String sessionId, String mode) {
    }

    /** Nulls are sent explicitly so clients can tell an untitled or running meeting. */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record MeetingInfo(String id, String title, long startedAt, Long endedAt, long createdAt) {
    }

    public record MeetingListData(List<MeetingInfo> meetings) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HistoryTranscript(
            String text,
            long timestamp,
            @JsonProperty("isFinal") boolean isFinal,
            Integer speaker,
            Double startTime,
            @JsonProperty("isUtteranceEnd") Boolean isUtteranceEnd) {
    }

    public record HistoryAnalysis(List<String> summary, List<String> topics, List<String> tags,
                                  int flow, int heat, long timestamp) {
    }

    public record HistoryImage(String url, String prompt, long timestamp) {
    }

    public record HistoryCapture(String url, long timestamp) {
    }

    public record HistoryMetaSummary(List<String> summary, List<String> themes, long startTime, long endTime) {
    }

    public record MeetingHistoryData(
            String meetingId,
            List<HistoryTranscript> transcripts,
            List<HistoryAnalysis> analyses,
            List<HistoryImage> images,
            List<HistoryCapture> captures,
            List<HistoryMetaSummary> metaSummaries,
            Map<String, String> speakerAliases) {
    }

    public record SpeakerAliasData(Map<String, String> speakerAliases) {
    }

    public record ImageModelStatusData(String preset, String model, boolean available) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorData(String message, String code) {
    }
}
