package com.phillippitts.graphicrecorder.service.provider;

import com.phillippitts.graphicrecorder.service.context.MetaSummaryContent;
import com.phillippitts.graphicrecorder.service.context.MetaSummaryInput;

import java.util.concurrent.CompletableFuture;

/** Condenses a run of analyses into one meta-summary. */
@FunctionalInterface
public interface MetaSummarizer {

    CompletableFuture<MetaSummaryContent> summarize(MetaSummaryInput input);
}
