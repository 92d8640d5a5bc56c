package com.phillippitts.graphicrecorder.domain;

import java.util.Objects;

/** An image produced by the image provider, base64-encoded PNG. */
public record GeneratedImage(String base64, String prompt, long timestamp) {
    public GeneratedImage {
        Objects.requireNonNull(base64, "base64");
        prompt = prompt == null ? "" : prompt;
    }
}
