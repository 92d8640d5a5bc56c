package com.phillippitts.graphicrecorder.util;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns arbitrary failure messages into text that is safe to send to a client.
 *
 * <p>Messages that look like they carry file paths, OS error names or credentials are
 * replaced with a generic message; everything else is capped at {@value #MAX_LENGTH}
 * characters.
 */
public final class ErrorSanitizer {

    static final int MAX_LENGTH = 200;
    static final String INTERNAL = "An internal error occurred";
    static final String UNEXPECTED = "An unexpected error occurred";

    private static final List<String> SENSITIVE_MARKERS =
            List.of("/", "\\", "ENOENT", "EACCES", "api_key", "API key");

    private ErrorSanitizer() {}

    public static String sanitize(Throwable error) {
        if (error == null) {
            return UNEXPECTED;
        }
        return sanitize(rootMessage(error));
    }

    public static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return UNEXPECTED;
        }
        for (String marker : SENSITIVE_MARKERS) {
            if (message.contains(marker)) {
                return INTERNAL;
            }
        }
        if (message.length() > MAX_LENGTH) {
            return message.substring(0, MAX_LENGTH) + "...";
        }
        return message;
    }

    // CompletionException and ExecutionException wrap the failure we actually care about
    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
