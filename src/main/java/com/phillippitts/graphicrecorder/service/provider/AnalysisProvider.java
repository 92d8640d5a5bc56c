package com.phillippitts.graphicrecorder.service.provider;

import com.phillippitts.graphicrecorder.domain.AnalysisResult;

import java.util.concurrent.CompletableFuture;

/** LLM analysis of transcript text against the meeting context. */
@FunctionalInterface
public interface AnalysisProvider {

    CompletableFuture<AnalysisResult> analyze(AnalysisRequest request);
}
