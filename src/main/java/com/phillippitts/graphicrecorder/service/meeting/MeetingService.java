package com.phillippitts.graphicrecorder.service.meeting;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.graphicrecorder.domain.Meeting;
import com.phillippitts.graphicrecorder.domain.MeetingMode;
import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.protocol.ServerMessages;
import com.phillippitts.graphicrecorder.service.events.RecordingLockConflictEvent;
import com.phillippitts.graphicrecorder.service.lock.RecordingLockManager;
import com.phillippitts.graphicrecorder.service.persistence.MeetingStore;
import com.phillippitts.graphicrecorder.service.persistence.PersistenceWriter;
import com.phillippitts.graphicrecorder.service.session.ConnectionContext;
import com.phillippitts.graphicrecorder.service.session.MeetingConnections;
import com.phillippitts.graphicrecorder.service.session.SessionOrchestrator;
import com.phillippitts.graphicrecorder.util.Ids;
import com.phillippitts.graphicrecorder.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Meeting-level use cases of a connection: start or join, stop, list, rename, speaker
 * aliases, mode switches and history catch-up.
 *
 * <p>Methods run on the connection's serial executor and report validation failures as
 * {@link DomainException}. Checks run in a fixed order (meeting, then mode, then payload)
 * so a client always gets the most fundamental error first.
 */
@Service
public class MeetingService {

    private static final Logger LOG = LogManager.getLogger(MeetingService.class);

    static final int LIST_LIMIT = 50;

    private final MeetingStore store;
    private final PersistenceWriter writer;
    private final RecordingLockManager locks;
    private final MeetingConnections connections;
    private final SessionOrchestrator sessions;
    private final MeetingHistoryMapper history;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public MeetingService(MeetingStore store,
                          PersistenceWriter writer,
                          RecordingLockManager locks,
                          MeetingConnections connections,
                          SessionOrchestrator sessions,
                          MeetingHistoryMapper history,
                          ApplicationEventPublisher events,
                          Clock clock) {
        this.store = store;
        this.writer = writer;
        this.locks = locks;
        this.connections = connections;
        this.sessions = sessions;
        this.history = history;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Handles {@code meeting:start}: creates a meeting, or joins an existing one when
     * {@code meetingId} is given. Joining sends the full stored history after the status.
     */
    public void start(ConnectionContext ctx, JsonNode data) {
        MeetingStartRequest request = MeetingPayloads.readStart(data)
                .orElseThrow(() -> new DomainException(ErrorCode.INVALID_MEETING_PAYLOAD, "Invalid meeting payload"));

        Meeting existing = null;
        if (request.meetingId() != null) {
            existing = findValidMeeting(request.meetingId());
        }
        MeetingMode mode = MeetingMode.resolve(request.mode(), existing != null);
        if (existing != null && mode == MeetingMode.RECORD) {
            requireLockAvailable(ctx, existing.id());
        }

        String previous = ctx.meetingId();
        boolean sameMeeting = existing != null && existing.id().equals(previous);
        if (sameMeeting && ctx.isRecording() && mode == MeetingMode.VIEW) {
            throw new DomainException(ErrorCode.RECORDING_IN_PROGRESS, "Stop recording before switching to view mode");
        }
        if (previous != null && !sameMeeting) {
            leave(ctx, previous);
        }

        Meeting meeting = existing != null ? existing : store.createMeeting(request.title(), ctx.userId());
        ctx.setMeetingId(meeting.id());
        ctx.setMode(mode);
        if (!ctx.isRecording()) {
            store.upsertSession(meeting.id(), ctx.sessionId());
        }
        if (mode == MeetingMode.VIEW) {
            locks.release(meeting.id(), ctx.sessionId());
        }
        connections.join(meeting.id(), ctx);
        LOG.info("Meeting {} (meeting={}, mode={}, title=\"{}\")", existing != null ? "joined" : "created",
                meeting.id(), mode.wire(), LogSanitizer.preview(meeting.title()));

        ctx.send(ServerMessages.meetingStatus(meeting.id(), meeting.title(), ctx.sessionId(), mode));
        if (existing != null) {
            ctx.send(ServerMessages.meetingHistory(history.full(meeting.id())));
        }
    }

    /** Handles {@code meeting:stop}: stops any recording and ends the meeting. */
    public void stop(ConnectionContext ctx) {
        String meetingId = ctx.meetingId();
        if (meetingId == null) {
            return;
        }
        if (ctx.isRecordMode()) {
            writer.run("endMeeting", () -> store.endMeeting(meetingId));
        }
        leave(ctx, meetingId);
        LOG.info("Meeting stopped (meeting={})", meetingId);
    }

    public void list(ConnectionContext ctx) {
        ctx.send(ServerMessages.meetingList(store.listMeetings(LIST_LIMIT)));
    }

    /** Handles {@code meeting:update{title}}; every viewer gets the new title. */
    public void update(ConnectionContext ctx, JsonNode data) {
        String title = MeetingPayloads.readText(data, "title");
        if (title == null) {
            throw new DomainException(ErrorCode.INVALID_MEETING_PAYLOAD, "Invalid meeting update payload");
        }
        String meetingId = ctx.meetingId();
        if (meetingId == null) {
            throw new DomainException(ErrorCode.NO_ACTIVE_MEETING, "No active meeting to update");
        }
        Meeting updated = store.updateMeetingTitle(meetingId, title);
        LOG.info("Meeting renamed (meeting={}, title=\"{}\")", meetingId, LogSanitizer.preview(updated.title()));
        connections.forEachMember(meetingId, member -> member.post(() -> {
            if (meetingId.equals(member.meetingId())) {
                member.send(ServerMessages.meetingStatus(meetingId, updated.title(), member.sessionId(), member.mode()));
            }
        }));
    }

    /**
     * Handles {@code meeting:speaker-alias:update{speaker, displayName}}. A blank name
     * removes the alias. The full alias map is sent to every viewer.
     */
    public void updateSpeakerAlias(ConnectionContext ctx, JsonNode data) {
        String meetingId = ctx.meetingId();
        if (meetingId == null) {
            throw new DomainException(ErrorCode.NO_ACTIVE_MEETING, "No active meeting to update");
        }
        if (!ctx.isRecordMode()) {
            throw new DomainException(ErrorCode.READ_ONLY_MEETING, "This meeting is in read-only mode");
        }
        if (MeetingPayloads.isAbsent(data) || !data.isObject()) {
            throw new DomainException(ErrorCode.INVALID_ALIAS_PAYLOAD, "Invalid alias payload");
        }
        int speaker = MeetingPayloads.readSpeaker(data)
                .orElseThrow(() -> new DomainException(ErrorCode.INVALID_SPEAKER, "Invalid speaker index"));
        String displayName = MeetingPayloads.readText(data, "displayName");
        if (displayName == null) {
            throw new DomainException(ErrorCode.INVALID_DISPLAY_NAME, "Invalid display name");
        }
        String trimmed = displayName.trim();
        if (trimmed.isEmpty()) {
            store.deleteSpeakerAlias(meetingId, speaker);
        } else {
            store.upsertSpeakerAlias(meetingId, speaker, trimmed);
        }
        connections.broadcast(meetingId, ServerMessages.speakerAliases(history.speakerAliases(meetingId)));
    }

    /** Handles {@code meeting:mode:set{mode}}. */
    public void setMode(ConnectionContext ctx, JsonNode data) {
        MeetingMode mode = MeetingPayloads.readMode(data)
                .orElseThrow(() -> new DomainException(ErrorCode.INVALID_MEETING_MODE, "Invalid meeting mode payload"));
        String meetingId = ctx.meetingId();
        if (meetingId == null) {
            throw new DomainException(ErrorCode.NO_ACTIVE_MEETING, "No active meeting to update");
        }
        if (mode == MeetingMode.VIEW) {
            if (ctx.isRecording() || ctx.isTranscriptionOpening()) {
                throw new DomainException(ErrorCode.RECORDING_IN_PROGRESS,
                        "Stop recording before switching to view mode");
            }
            locks.release(meetingId, ctx.sessionId());
        } else {
            requireLockAvailable(ctx, meetingId);
        }
        ctx.setMode(mode);
        Meeting meeting = store.findMeeting(meetingId)
                .orElseThrow(() -> new DomainException(ErrorCode.MEETING_NOT_FOUND, "Meeting not found"));
        LOG.info("Meeting mode set to {} (meeting={})", mode.wire(), meetingId);
        ctx.send(ServerMessages.meetingStatus(meetingId, meeting.title(), ctx.sessionId(), mode));
    }

    /**
     * Handles {@code meeting:history:request{meetingId, cursor?}}: sends what the client
     * is missing for its active meeting.
     */
    public void requestHistory(ConnectionContext ctx, JsonNode data) {
        HistoryRequest request = MeetingPayloads.readHistoryRequest(data)
                .orElseThrow(() -> new DomainException(ErrorCode.INVALID_MEETING_HISTORY_REQUEST,
                        "Invalid history request payload"));
        if (!Ids.isValidMeetingId(request.meetingId())) {
            throw new DomainException(ErrorCode.INVALID_MEETING_ID, "Invalid meeting ID format");
        }
        if (!request.meetingId().equals(ctx.meetingId())) {
            throw new DomainException(ErrorCode.NO_ACTIVE_MEETING, "No active meeting context");
        }
        if (store.findMeeting(request.meetingId()).isEmpty()) {
            throw new DomainException(ErrorCode.MEETING_NOT_FOUND, "Meeting not found");
        }
        ctx.send(ServerMessages.meetingHistoryDelta(history.since(request.meetingId(), request.cursor())));
    }

    /** Releases the connection's recording lock, if it holds one. Used on socket close. */
    public void releaseRecordingLock(ConnectionContext ctx) {
        String meetingId = ctx.meetingId();
        if (meetingId != null && !ctx.isSuperseded()) {
            locks.release(meetingId, ctx.sessionId());
        }
    }

    private Meeting findValidMeeting(String meetingId) {
        if (!Ids.isValidMeetingId(meetingId)) {
            throw new DomainException(ErrorCode.INVALID_MEETING_ID, "Invalid meeting ID format");
        }
        return store.findMeeting(meetingId)
                .orElseThrow(() -> new DomainException(ErrorCode.MEETING_NOT_FOUND, "Meeting not found"));
    }

    private void requireLockAvailable(ConnectionContext ctx, String meetingId) {
        if (locks.isLockedByAnother(meetingId, ctx.sessionId())) {
            events.publishEvent(new RecordingLockConflictEvent(meetingId, ctx.sessionId(),
                    locks.holderOf(meetingId).orElse(null), clock.instant()));
            throw new DomainException(ErrorCode.MEETING_ALREADY_RECORDING,
                    "Another user is already recording this meeting");
        }
    }

    private void leave(ConnectionContext ctx, String meetingId) {
        if (ctx.isRecording() || ctx.isTranscriptionOpening()) {
            sessions.stop(ctx);
        }
        locks.release(meetingId, ctx.sessionId());
        connections.leave(meetingId, ctx);
        ctx.setMeetingId(null);
        ctx.setMode(null);
    }
}
