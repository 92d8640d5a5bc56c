package com.phillippitts.graphicrecorder.service.context;

import com.phillippitts.graphicrecorder.domain.AnalysisRecord;
import com.phillippitts.graphicrecorder.domain.CameraFrame;
import com.phillippitts.graphicrecorder.domain.MetaSummary;

import java.util.List;

/**
 * Analysis input whose size stays bounded however long the meeting runs.
 *
 * <ul>
 *   <li>Tier 1 (short-term): current transcript, the last few analyses and images of the
 *       meeting, and the camera frames of the current session</li>
 *   <li>Tier 2 (medium-term): every meta-summary of the meeting</li>
 *   <li>Tier 3 (long-term): distinct themes across all meta-summaries</li>
 * </ul>
 */
public record HierarchicalContext(
        String transcript,
        List<AnalysisRecord> recentAnalyses,
        List<RecentImage> recentImages,
        List<CameraFrame> cameraFrames,
        List<MetaSummary> metaSummaries,
        List<String> overallThemes
) {
    public HierarchicalContext {
        transcript = transcript == null ? "" : transcript;
        recentAnalyses = List.copyOf(recentAnalyses);
        recentImages = List.copyOf(recentImages);
        cameraFrames = List.copyOf(cameraFrames);
        metaSummaries = List.copyOf(metaSummaries);
        overallThemes = List.copyOf(overallThemes);
    }

    /** Context for a session with no meeting history at all. */
    public static HierarchicalContext transcriptOnly(String transcript, List<CameraFrame> cameraFrames) {
        return new HierarchicalContext(transcript, List.of(), List.of(), cameraFrames, List.of(), List.of());
    }
}
