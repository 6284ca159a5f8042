package com.wordcomplexity.domain.phonology.service;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;

import java.util.List;

/**
 * Domain service interface for splitting an ARPABET pronunciation into syllables.
 */
public interface SyllabificationService {

    /**
     * Syllabify with the configured Alaska rule setting.
     *
     * @param pronunciation the word's phonemes, in order
     * @return one syllable per vowel, in order
     * @throws com.wordcomplexity.domain.phonology.exception.SyllabificationException
     *         if the syllables do not reproduce the input exactly
     */
    List<Syllable> syllabify(List<Phoneme> pronunciation);

    /**
     * Syllabify with an explicit Alaska rule setting.
     *
     * @param pronunciation the word's phonemes, in order
     * @param alaskaRule    whether an S after a stressed lax vowel closes the preceding syllable
     * @return one syllable per vowel, in order
     */
    List<Syllable> syllabify(List<Phoneme> pronunciation, boolean alaskaRule);
}
