package com.phillippitts.graphicrecorder.util;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/** Identifier generation and validation for meetings and sessions. */
public final class Ids {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private Ids() {}

    public static String newMeetingId() {
        return UUID.randomUUID().toString();
    }

    /** Generates {@code session-<epochMillis>-<random>}. */
    public static String newSessionId(long nowMillis) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "session-" + nowMillis + "-" + LogSanitizer.truncate(suffix, 7);
    }

    public static boolean isValidMeetingId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }

    public static boolean isValidSessionId(String id) {
        return id != null && SESSION_ID_PATTERN.matcher(id).matches();
    }
}
