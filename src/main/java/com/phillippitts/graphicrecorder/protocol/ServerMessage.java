package com.phillippitts.graphicrecorder.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One server-to-client control frame: {@code {"type": ..., "data": ...}}.
 *
 * <p>Build instances through {@link ServerMessages}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(String type, Object data) {
    public ServerMessage {
        Objects.requireNonNull(type, "type");
    }
}
