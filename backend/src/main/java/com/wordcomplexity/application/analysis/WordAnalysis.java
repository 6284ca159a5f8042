package com.wordcomplexity.application.analysis;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;
import com.wordcomplexity.domain.phonology.model.WordComplexity;

import java.util.List;

/**
 * Everything computed for one pronunciation.
 *
 * @param word          the headword, or null when the pronunciation was given directly
 * @param pronunciation the input phonemes
 * @param syllables     the syllabification
 * @param syllabified   pretty-printed syllables, e.g. "K-AE1-T"
 * @param destressed    pretty-printed syllables without stress digits
 * @param complexity    Word Complexity Measure breakdown
 */
public record WordAnalysis(
        String word,
        List<Phoneme> pronunciation,
        List<Syllable> syllables,
        String syllabified,
        String destressed,
        WordComplexity complexity
) {
    public int syllableCount() {
        return syllables.size();
    }

    public int score() {
        return complexity.total();
    }
}
