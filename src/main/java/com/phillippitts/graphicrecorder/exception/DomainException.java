package com.phillippitts.graphicrecorder.exception;

import java.util.Objects;

/**
 * Thrown when a client request fails validation or violates a meeting rule
 * (unknown meeting, lock conflict, read-only mode, bad payload).
 *
 * <p>The message is client-facing and is sent verbatim in the {@code error} frame
 * together with {@link #getCode()}. Never put internal details in it.
 */
public class DomainException extends GraphicRecorderException {

    private final ErrorCode code;

    public DomainException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }
}
