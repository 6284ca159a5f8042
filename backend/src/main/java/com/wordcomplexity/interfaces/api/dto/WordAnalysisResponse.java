package com.wordcomplexity.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wordcomplexity.application.analysis.WordAnalysis;
import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;
import com.wordcomplexity.domain.phonology.model.WordComplexity;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WordAnalysisResponse(
        String word,
        String pronunciation,
        List<SyllableEntry> syllables,
        String syllabified,
        String destressed,
        int score,
        ScoreEntry breakdown
) {
    public record SyllableEntry(List<String> onset, List<String> nucleus, List<String> coda) {}

    public record ScoreEntry(int wordPatterns, int syllableStructures, int soundClasses,
                             int polysyllabic, int nonInitialStress, int finalConsonant,
                             int onsetClusters, int codaClusters, int dorsals, int liquids,
                             int fricativesAffricates, int voicedFricativesAffricates) {}

    /**
     * Convert a domain analysis to its JSON shape.
     */
    public static WordAnalysisResponse from(WordAnalysis analysis) {
        WordComplexity c = analysis.complexity();
        return new WordAnalysisResponse(
                analysis.word(),
                String.join(" ", symbols(analysis.pronunciation())),
                analysis.syllables().stream().map(WordAnalysisResponse::toEntry).toList(),
                analysis.syllabified(),
                analysis.destressed(),
                analysis.score(),
                new ScoreEntry(c.wordPatterns(), c.syllableStructures(), c.soundClasses(),
                        c.polysyllabic(), c.nonInitialStress(), c.finalConsonant(),
                        c.onsetClusters(), c.codaClusters(), c.dorsals(), c.liquids(),
                        c.fricativesAffricates(), c.voicedFricativesAffricates()));
    }

    private static SyllableEntry toEntry(Syllable s) {
        return new SyllableEntry(symbols(s.onset()), symbols(s.nucleus()), symbols(s.coda()));
    }

    private static List<String> symbols(List<Phoneme> phonemes) {
        return phonemes.stream().map(Phoneme::arpabet).toList();
    }
}
