package com.phillippitts.graphicrecorder.service.meeting;

import com.phillippitts.graphicrecorder.domain.MeetingMode;

/**
 * Parsed {@code meeting:start}. Every field is optional: no {@code meetingId} creates a new
 * meeting, no {@code mode} lets {@link MeetingMode#resolve} decide.
 */
public record MeetingStartRequest(String title, String meetingId, MeetingMode mode) {
}
