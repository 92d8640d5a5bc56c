package com.phillippitts.graphicrecorder.service.context;

/** A recently generated image with its payload loaded, for the short-term context tier. */
public record RecentImage(long id, String base64, String prompt, long timestamp) {
}
