package com.phillippitts.graphicrecorder.service.report;

import java.util.Locale;

/**
 * What goes into a report archive.
 *
 * @param includeMedia    false leaves images and captures out and lists them as missing
 * @param includeCaptures camera captures are only bundled on request
 * @param onMediaLimit    what happens when media would exceed the size budget
 */
public record ReportOptions(boolean includeMedia, boolean includeCaptures, MediaLimitPolicy onMediaLimit) {

    public enum MediaLimitPolicy {
        /** Refuse the whole export. */
        ERROR("error"),
        /** Leave the item out and list it as missing. */
        SKIP("skip");

        private final String wire;

        MediaLimitPolicy(String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }
    }

    /**
     * Reads the {@code media} and {@code captures} query parameters. {@code media=none}
     * drops media, {@code strict} or {@code error} refuse an oversized bundle, anything
     * else (the default {@code auto}) skips what does not fit. {@code captures=1} adds
     * camera captures.
     */
    public static ReportOptions fromQuery(String media, String captures) {
        String mode = media == null ? "auto" : media.trim().toLowerCase(Locale.ROOT);
        boolean strict = "strict".equals(mode) || "error".equals(mode);
        return new ReportOptions(!"none".equals(mode), "1".equals(captures),
                strict ? MediaLimitPolicy.ERROR : MediaLimitPolicy.SKIP);
    }
}
