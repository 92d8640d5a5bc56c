package com.phillippitts.graphicrecorder.presentation.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.protocol.MessageTypes;
import com.phillippitts.graphicrecorder.protocol.ServerMessages;
import com.phillippitts.graphicrecorder.service.meeting.ImageModelService;
import com.phillippitts.graphicrecorder.service.meeting.MeetingService;
import com.phillippitts.graphicrecorder.service.metrics.RecordingMetrics;
import com.phillippitts.graphicrecorder.service.session.ConnectionContext;
import com.phillippitts.graphicrecorder.service.session.SessionOrchestrator;
import com.phillippitts.graphicrecorder.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Dispatches inbound frames of one connection to the use cases.
 *
 * <p>Every failure is answered on the same connection and never closes it: protocol
 * errors with {@code "Invalid message format"}, domain errors with their code, anything
 * else with a sanitized message.
 */
@Component
public class MessageRouter {

    private static final Logger LOG = LogManager.getLogger(MessageRouter.class);

    static final String INVALID_FORMAT = "Invalid message format";

    private final ObjectMapper mapper;
    private final MeetingService meetings;
    private final SessionOrchestrator sessions;
    private final ImageModelService imageModels;
    private final RecordingMetrics metrics;

    public MessageRouter(ObjectMapper mapper,
                         MeetingService meetings,
                         SessionOrchestrator sessions,
                         ImageModelService imageModels,
                         RecordingMetrics metrics) {
        this.mapper = mapper;
        this.meetings = meetings;
        this.sessions = sessions;
        this.imageModels = imageModels;
        this.metrics = metrics;
    }

    /** Routes one text frame; must run on the connection's serial executor. */
    public void route(ConnectionContext ctx, String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            rejectFormat(ctx, "unparseable JSON");
            return;
        }
        if (root == null || !root.isObject() || !root.path("type").isTextual()) {
            rejectFormat(ctx, "missing type");
            return;
        }
        String type = root.get("type").asText();
        JsonNode data = root.get("data");
        try {
            if (!dispatch(ctx, type, data)) {
                rejectFormat(ctx, "unknown type");
            }
        } catch (DomainException e) {
            LOG.debug("Rejected {}: {} ({})", type, e.getMessage(), e.getCode());
            ctx.send(ServerMessages.error(e.getMessage(), e.getCode()));
        } catch (RuntimeException e) {
            LOG.error("Error handling {}", type, e);
            ctx.send(ServerMessages.error(ErrorSanitizer.sanitize(e), null));
        }
    }

    /** Routes one binary frame: raw audio for the recording session. */
    public void routeBinary(ConnectionContext ctx, byte[] chunk) {
        if (!ctx.isRecordMode()) {
            ctx.send(ServerMessages.error("Meeting is read-only in view mode", ErrorCode.READ_ONLY_MEETING));
            return;
        }
        try {
            sessions.handleAudioChunk(ctx, chunk);
        } catch (RuntimeException e) {
            LOG.error("Error handling audio chunk", e);
            ctx.send(ServerMessages.error(ErrorSanitizer.sanitize(e), null));
        }
    }

    private boolean dispatch(ConnectionContext ctx, String type, JsonNode data) {
        switch (type) {
            case MessageTypes.MEETING_START -> meetings.start(ctx, data);
            case MessageTypes.MEETING_STOP -> meetings.stop(ctx);
            case MessageTypes.MEETING_LIST_REQUEST -> meetings.list(ctx);
            case MessageTypes.MEETING_UPDATE -> meetings.update(ctx, data);
            case MessageTypes.MEETING_SPEAKER_ALIAS_UPDATE -> meetings.updateSpeakerAlias(ctx, data);
            case MessageTypes.MEETING_MODE_SET -> meetings.setMode(ctx, data);
            case MessageTypes.MEETING_HISTORY_REQUEST -> meetings.requestHistory(ctx, data);
            case MessageTypes.SESSION_START -> sessions.start(ctx);
            case MessageTypes.SESSION_STOP -> sessions.stop(ctx);
            case MessageTypes.CAMERA_FRAME -> sessions.handleCameraFrame(ctx, data);
            case MessageTypes.IMAGE_MODEL_SET -> imageModels.setPreset(ctx, data);
            default -> {
                return false;
            }
        }
        return true;
    }

    private void rejectFormat(ConnectionContext ctx, String reason) {
        metrics.incrementProtocolError();
        LOG.debug("Invalid message format: {}", reason);
        ctx.send(ServerMessages.error(INVALID_FORMAT, null));
    }
}
