package com.wordcomplexity.infrastructure.phonology.resolution;

import com.wordcomplexity.domain.phonology.model.Phoneme;

import java.util.List;

/**
 * Final onsets and codas, one entry per syllable.
 * The last coda is left empty; the word-final tail is attached by the caller.
 */
public record ResolvedBoundaries(List<List<Phoneme>> onsets, List<List<Phoneme>> codas) {}
