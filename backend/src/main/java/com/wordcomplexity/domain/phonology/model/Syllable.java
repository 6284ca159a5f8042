package com.wordcomplexity.domain.phonology.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One syllable of a syllabified pronunciation.
 * The nucleus holds the vowel and, when resolution attached them, a following R or a leading Y.
 */
public record Syllable(List<Phoneme> onset, List<Phoneme> nucleus, List<Phoneme> coda) {

    public Syllable {
        onset = List.copyOf(onset);
        nucleus = List.copyOf(nucleus);
        coda = List.copyOf(coda);
    }

    /**
     * Onset, nucleus and coda in order.
     */
    public List<Phoneme> segments() {
        List<Phoneme> all = new ArrayList<>(onset.size() + nucleus.size() + coda.size());
        all.addAll(onset);
        all.addAll(nucleus);
        all.addAll(coda);
        return all;
    }

    /**
     * Onset and coda consonants, the ones the complexity measure counts.
     */
    public List<Phoneme> margins() {
        List<Phoneme> all = new ArrayList<>(onset.size() + coda.size());
        all.addAll(onset);
        all.addAll(coda);
        return all;
    }
}
