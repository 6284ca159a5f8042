package com.wordcomplexity.interfaces.api.dto;

import com.wordcomplexity.application.analysis.BatchAnalysisResult;

import java.util.List;

public record BatchAnalysisResponse(
        List<WordAnalysisResponse> analyses,
        List<SkippedEntry> skipped
) {
    public record SkippedEntry(String pronunciation, String reason) {}

    public static BatchAnalysisResponse from(BatchAnalysisResult result) {
        return new BatchAnalysisResponse(
                result.analyses().stream().map(WordAnalysisResponse::from).toList(),
                result.skipped().stream()
                        .map(s -> new SkippedEntry(s.pronunciation(), s.reason()))
                        .toList());
    }
}
