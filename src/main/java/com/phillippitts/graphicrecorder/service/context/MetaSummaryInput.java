package com.phillippitts.graphicrecorder.service.context;

import com.phillippitts.graphicrecorder.domain.AnalysisRecord;
import com.phillippitts.graphicrecorder.domain.ImageRecord;

import java.util.List;

/**
 * The analyses (and images generated in the same span) that one compaction condenses.
 *
 * @param startTime timestamp of the first analysis
 * @param endTime   timestamp of the last analysis
 */
public record MetaSummaryInput(
        String meetingId,
        long startTime,
        long endTime,
        List<AnalysisRecord> analyses,
        List<ImageRecord> images
) {
    public MetaSummaryInput {
        analyses = List.copyOf(analyses);
        images = List.copyOf(images);
        if (analyses.isEmpty()) {
            throw new IllegalArgumentException("a meta-summary needs at least one analysis");
        }
    }
}
