package com.wordcomplexity.infrastructure.phonology.segmentation;

import com.wordcomplexity.domain.phonology.model.Phoneme;

import java.util.List;

/**
 * Raw syllable boundaries found by {@link NucleusOnsetSegmenter}.
 * The lists are mutable working buffers owned by a single syllabification.
 *
 * @param nuclei one group per vowel, initially holding just that vowel
 * @param onsets the phonemes between the previous vowel and each nucleus; index 0 is the word-initial onset
 * @param tail   phonemes after the last vowel, or the whole input if there is none
 */
public record SegmentationResult(
        List<List<Phoneme>> nuclei,
        List<List<Phoneme>> onsets,
        List<Phoneme> tail
) {
    public int nucleusCount() {
        return nuclei.size();
    }
}
