package com.phillippitts.graphicrecorder.service.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the summarizer produced. {@code representativeImageId} must name one of the input
 * images or be null.
 */
public record MetaSummaryContent(List<String> summary, List<String> themes, Long representativeImageId) {
    public MetaSummaryContent {
        summary = summary == null ? List.of() : List.copyOf(summary);
        themes = themes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(themes));
    }
}
