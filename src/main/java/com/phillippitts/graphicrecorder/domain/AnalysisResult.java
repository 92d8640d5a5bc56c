package com.phillippitts.graphicrecorder.domain;

import java.util.List;

/**
 * Output of one analysis pass. Flow and heat are clamped to [0, 100].
 */
public record AnalysisResult(
        List<String> summary,
        List<String> topics,
        List<String> tags,
        int flow,
        int heat,
        String imagePrompt
) {
    public AnalysisResult {
        summary = List.copyOf(summary);
        topics = List.copyOf(topics);
        tags = List.copyOf(tags);
        flow = clampPercent(flow);
        heat = clampPercent(heat);
        imagePrompt = imagePrompt == null ? "" : imagePrompt;
    }

    static int clampPercent(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
