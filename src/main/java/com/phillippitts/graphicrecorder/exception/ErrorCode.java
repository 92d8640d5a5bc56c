package com.phillippitts.graphicrecorder.exception;

/**
 * Typed error codes carried on {@code error} frames sent to clients and in HTTP error
 * bodies. The codes below {@code MEDIA_NOT_FOUND} only occur over HTTP.
 */
public enum ErrorCode {
    INVALID_MEETING_PAYLOAD,
    INVALID_MEETING_ID,
    MEETING_NOT_FOUND,
    MEETING_ALREADY_RECORDING,
    NO_ACTIVE_MEETING,
    READ_ONLY_MEETING,
    INVALID_ALIAS_PAYLOAD,
    INVALID_SPEAKER,
    INVALID_DISPLAY_NAME,
    INVALID_MEETING_MODE,
    RECORDING_IN_PROGRESS,
    INVALID_MEETING_HISTORY_REQUEST,
    INVALID_CAMERA_FRAME,
    INVALID_IMAGE_MODEL_PRESET,
    IMAGE_MODEL_NOT_CONFIGURED,
    MEDIA_NOT_FOUND,
    SESSION_NOT_FOUND,
    INVALID_SESSION_ID,
    UNSUPPORTED_AUDIO_TYPE,
    INVALID_AUDIO_UPLOAD,
    AUDIO_UPLOAD_TOO_LARGE,
    REPORT_TOO_LARGE
}
