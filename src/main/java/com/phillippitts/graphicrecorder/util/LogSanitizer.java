package com.phillippitts.graphicrecorder.util;

/** Utility for privacy-safe logging of user-supplied text (titles, aliases, transcripts). */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Preview for log lines: at most 40 characters, with newlines flattened so one
     * transcript fragment cannot forge extra log records.
     */
    public static String preview(String s) {
        return truncate(s, 40).replace('\n', ' ').replace('\r', ' ');
    }
}
