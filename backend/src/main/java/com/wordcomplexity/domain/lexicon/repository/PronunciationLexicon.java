package com.wordcomplexity.domain.lexicon.repository;

import com.wordcomplexity.domain.phonology.model.Phoneme;

import java.util.List;

/**
 * Read-only source of dictionary pronunciations.
 */
public interface PronunciationLexicon {

    /**
     * All pronunciations of a word, in dictionary order. Empty when the word is unknown.
     */
    List<List<Phoneme>> lookup(String word);

    boolean contains(String word);

    int size();

    /**
     * Distinct words sampled uniformly at random.
     *
     * @throws IllegalArgumentException if count is negative or exceeds {@link #size()}
     */
    List<String> randomWords(int count);
}
