package com.phillippitts.graphicrecorder.service.meeting;

import java.util.List;

/**
 * Newest timestamp a client already holds per history stream. A null field means the
 * client holds nothing of that stream, so everything is newer.
 */
public record HistoryCursor(Long transcriptTs, Long analysisTs, Long imageTs, Long captureTs,
                            Long metaSummaryEndTs) {

    public static final HistoryCursor EMPTY = new HistoryCursor(null, null, null, null, null);

    /** Wire names in constructor order. */
    static final List<String> FIELDS =
            List.of("transcriptTs", "analysisTs", "imageTs", "captureTs", "metaSummaryEndTs");

    static boolean isNewer(long timestamp, Long cursor) {
        return cursor == null || timestamp > cursor;
    }
}
