package com.wordcomplexity.domain.phonology.model;

/**
 * Word Complexity Measure points, one field per category.
 *
 * @param polysyllabic          1 when the word has more than two syllables
 * @param nonInitialStress      1 when a syllable other than the first carries primary stress
 * @param finalConsonant        1 when the last syllable has a coda
 * @param onsetClusters         number of syllables with two or more onset consonants
 * @param codaClusters          number of syllables with two or more coda consonants
 * @param dorsals               dorsal (velar) consonant occurrences
 * @param liquids               liquid occurrences
 * @param fricativesAffricates  fricative or affricate occurrences
 * @param voicedFricativesAffricates voiced fricative or affricate occurrences, counted on top of the previous field
 */
public record WordComplexity(
        int polysyllabic,
        int nonInitialStress,
        int finalConsonant,
        int onsetClusters,
        int codaClusters,
        int dorsals,
        int liquids,
        int fricativesAffricates,
        int voicedFricativesAffricates
) {
    public int wordPatterns() {
        return polysyllabic + nonInitialStress;
    }

    public int syllableStructures() {
        return finalConsonant + onsetClusters + codaClusters;
    }

    public int soundClasses() {
        return dorsals + liquids + fricativesAffricates + voicedFricativesAffricates;
    }

    public int total() {
        return wordPatterns() + syllableStructures() + soundClasses();
    }
}
