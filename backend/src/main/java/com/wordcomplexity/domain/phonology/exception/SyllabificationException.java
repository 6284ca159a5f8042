package com.wordcomplexity.domain.phonology.exception;

import com.wordcomplexity.domain.phonology.model.Phoneme;

import java.util.List;

/**
 * Thrown when the syllables produced for a pronunciation do not flatten back to it.
 */
public class SyllabificationException extends RuntimeException {

    private final List<Phoneme> pronunciation;
    private final List<Phoneme> syllabified;

    public SyllabificationException(List<Phoneme> pronunciation, List<Phoneme> syllabified) {
        super(String.format("Could not syllabify %s. Syllabified output: %s", pronunciation, syllabified));
        this.pronunciation = List.copyOf(pronunciation);
        this.syllabified = List.copyOf(syllabified);
    }

    public List<Phoneme> getPronunciation() {
        return pronunciation;
    }

    public List<Phoneme> getSyllabified() {
        return syllabified;
    }
}
