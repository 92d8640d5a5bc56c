package com.phillippitts.graphicrecorder.service.provider;

import com.phillippitts.graphicrecorder.service.context.HierarchicalContext;

import java.util.List;
import java.util.Objects;

/**
 * Input to one analysis pass.
 *
 * @param transcript     final transcript text since the previous analysis
 * @param previousTopics topics of the session's last analysis, for continuity
 * @param context        bounded hierarchical context of the whole meeting
 */
public record AnalysisRequest(String transcript, List<String> previousTopics, HierarchicalContext context) {
    public AnalysisRequest {
        Objects.requireNonNull(transcript, "transcript");
        previousTopics = List.copyOf(previousTopics);
        Objects.requireNonNull(context, "context");
    }
}
