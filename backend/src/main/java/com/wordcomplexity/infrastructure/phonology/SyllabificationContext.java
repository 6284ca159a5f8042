package com.wordcomplexity.infrastructure.phonology;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Working state of one syllabification call. Never shared between calls.
 */
@Data
public class SyllabificationContext {

    // --- Input ---
    private List<Phoneme> pronunciation;
    private boolean alaskaRule;

    // --- Segmentation ---
    private List<List<Phoneme>> nuclei = new ArrayList<>();
    private List<List<Phoneme>> onsets = new ArrayList<>();
    private List<Phoneme> tail = new ArrayList<>();

    // --- Resolution ---
    private List<List<Phoneme>> codas = new ArrayList<>();

    // --- Assembly ---
    private List<Syllable> syllables = new ArrayList<>();

    /**
     * Every syllable's onset, nucleus and coda in order.
     */
    public List<Phoneme> flatten() {
        List<Phoneme> flat = new ArrayList<>();
        for (Syllable syllable : syllables) {
            flat.addAll(syllable.segments());
        }
        return flat;
    }
}
