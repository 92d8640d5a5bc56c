package com.phillippitts.graphicrecorder.protocol;

/** Wire names of every control-frame type. */
public final class MessageTypes {

    // client -> server
    public static final String MEETING_START = "meeting:start";
    public static final String MEETING_STOP = "meeting:stop";
    public static final String MEETING_LIST_REQUEST = "meeting:list:request";
    public static final String MEETING_UPDATE = "meeting:update";
    public static final String MEETING_SPEAKER_ALIAS_UPDATE = "meeting:speaker-alias:update";
    public static final String MEETING_MODE_SET = "meeting:mode:set";
    public static final String MEETING_HISTORY_REQUEST = "meeting:history:request";
    public static final String SESSION_START = "session:start";
    public static final String SESSION_STOP = "session:stop";
    public static final String CAMERA_FRAME = "camera:frame";
    public static final String IMAGE_MODEL_SET = "image:model:set";

    // server -> client
    public static final String SESSION_STATUS = "session:status";
    public static final String TRANSCRIPT = "transcript";
    public static final String ANALYSIS = "analysis";
    public static final String IMAGE = "image";
    public static final String GENERATION_STATUS = "generation:status";
    public static final String UTTERANCE_END = "utterance:end";
    public static final String STT_STATUS = "stt:status";
    public static final String MEETING_STATUS = "meeting:status";
    public static final String MEETING_LIST = "meeting:list";
    public static final String MEETING_HISTORY = "meeting:history";
    public static final String MEETING_HISTORY_DELTA = "meeting:history:delta";
    public static final String MEETING_SPEAKER_ALIAS = "meeting:speaker-alias";
    public static final String IMAGE_MODEL_STATUS = "image:model:status";
    public static final String ERROR = "error";

    private MessageTypes() {}
}
