package com.phillippitts.graphicrecorder.domain;

import java.util.Objects;

/** A still frame from the meeting camera or shared screen, base64-encoded JPEG. */
public record CameraFrame(String base64, long timestamp) {
    public CameraFrame {
        Objects.requireNonNull(base64, "base64");
    }
}
