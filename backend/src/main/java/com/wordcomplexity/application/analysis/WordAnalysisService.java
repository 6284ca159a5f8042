package com.wordcomplexity.application.analysis;

import com.wordcomplexity.application.analysis.BatchAnalysisResult.SkippedPronunciation;
import com.wordcomplexity.application.analysis.exception.WordNotFoundException;
import com.wordcomplexity.domain.lexicon.repository.PronunciationLexicon;
import com.wordcomplexity.domain.phonology.exception.InvalidInputException;
import com.wordcomplexity.domain.phonology.exception.SyllabificationException;
import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;
import com.wordcomplexity.domain.phonology.service.SyllabificationService;
import com.wordcomplexity.infrastructure.phonology.StressRemover;
import com.wordcomplexity.infrastructure.phonology.SyllableFormatter;
import com.wordcomplexity.infrastructure.phonology.complexity.WordComplexityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class WordAnalysisService {

    private final SyllabificationService syllabificationService;
    private final WordComplexityScorer complexityScorer;
    private final StressRemover stressRemover;
    private final SyllableFormatter formatter;
    private final PronunciationLexicon lexicon;

    @Value("${wcm.batch.max-size:500}")
    private int maxBatchSize;

    /**
     * Syllabify and score a single pronunciation.
     */
    public WordAnalysis analyze(List<Phoneme> pronunciation, boolean alaskaRule) {
        return analyze(null, pronunciation, alaskaRule);
    }

    public WordAnalysis analyze(String pronunciation, boolean alaskaRule) {
        List<Phoneme> phonemes = formatter.parse(pronunciation);
        if (phonemes.isEmpty()) {
            throw new IllegalArgumentException("Pronunciation must contain at least one phoneme");
        }
        return analyze(null, phonemes, alaskaRule);
    }

    /**
     * Analyze every dictionary pronunciation of a word. Pronunciations that
     * cannot be syllabified are logged and left out.
     */
    public List<WordAnalysis> analyzeWord(String word, boolean alaskaRule) {
        List<List<Phoneme>> pronunciations = lexicon.lookup(word);
        if (pronunciations.isEmpty()) {
            throw new WordNotFoundException(word);
        }

        List<WordAnalysis> results = new ArrayList<>();
        for (List<Phoneme> pronunciation : pronunciations) {
            try {
                results.add(analyze(word, pronunciation, alaskaRule));
            } catch (SyllabificationException e) {
                log.warn("Skipping pronunciation of '{}': {}", word, e.getMessage());
            }
        }
        return results;
    }

    /**
     * Analyze independent pronunciations in parallel. A failing input is
     * recorded as skipped and never aborts the batch; output keeps input order.
     */
    public BatchAnalysisResult analyzeBatch(List<String> pronunciations, boolean alaskaRule) {
        if (pronunciations.size() > maxBatchSize) {
            throw new IllegalArgumentException(String.format(
                    "Batch size %d exceeds the maximum of %d", pronunciations.size(), maxBatchSize));
        }

        List<CompletableFuture<Outcome>> futures = pronunciations.stream()
                .map(p -> CompletableFuture.supplyAsync(() -> attempt(p, alaskaRule)))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<WordAnalysis> analyses = new ArrayList<>();
        List<SkippedPronunciation> skipped = new ArrayList<>();
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            if (outcome.analysis() != null) {
                analyses.add(outcome.analysis());
            } else {
                skipped.add(outcome.skipped());
            }
        }

        log.info("Batch analysis: {} analysed, {} skipped", analyses.size(), skipped.size());
        return new BatchAnalysisResult(analyses, skipped);
    }

    /**
     * Analyze randomly chosen lexicon words, every pronunciation of each.
     */
    public List<WordAnalysis> sampleWords(int count, boolean alaskaRule) {
        List<WordAnalysis> results = new ArrayList<>();
        for (String word : lexicon.randomWords(count)) {
            results.addAll(analyzeWord(word, alaskaRule));
        }
        return results;
    }

    // ===== Internal methods =====

    private WordAnalysis analyze(String word, List<Phoneme> pronunciation, boolean alaskaRule) {
        List<Syllable> syllables = syllabificationService.syllabify(pronunciation, alaskaRule);
        if (syllables.isEmpty()) {
            throw new IllegalArgumentException("Pronunciation must contain at least one phoneme");
        }
        return new WordAnalysis(
                word,
                List.copyOf(pronunciation),
                syllables,
                formatter.prettyPrint(syllables),
                formatter.prettyPrint(stressRemover.destress(syllables)),
                complexityScorer.breakdown(syllables));
    }

    private Outcome attempt(String pronunciation, boolean alaskaRule) {
        try {
            return new Outcome(analyze(pronunciation, alaskaRule), null);
        } catch (SyllabificationException | InvalidInputException | IllegalArgumentException e) {
            log.warn("Skipping '{}': {}", pronunciation, e.getMessage());
            return new Outcome(null, new SkippedPronunciation(pronunciation, e.getMessage()));
        }
    }

    private record Outcome(WordAnalysis analysis, SkippedPronunciation skipped) {}
}
