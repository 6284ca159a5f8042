package com.wordcomplexity.application.analysis;

import java.util.List;

/**
 * Outcome of a batch: successful analyses plus the inputs that could not be syllabified.
 */
public record BatchAnalysisResult(
        List<WordAnalysis> analyses,
        List<SkippedPronunciation> skipped
) {
    public record SkippedPronunciation(String pronunciation, String reason) {}
}
