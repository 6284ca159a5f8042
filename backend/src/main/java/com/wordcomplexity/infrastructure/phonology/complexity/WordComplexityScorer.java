package com.wordcomplexity.infrastructure.phonology.complexity;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Stress;
import com.wordcomplexity.domain.phonology.model.Syllable;
import com.wordcomplexity.domain.phonology.model.WordComplexity;
import com.wordcomplexity.infrastructure.phonology.PhonemeInventory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Word Complexity Measure over a syllabified word.
 * <p>
 * Reference: C. Stoel-Gammon. 2010. The Word Complexity Measure: Description and
 * application to developmental phonology and disorders. Clinical Linguistics and
 * Phonetics 24(4-5): 271-282.
 * </p>
 * Voiced fricatives and affricates score under both the general and the voiced
 * class, as in the published point table.
 */
@Component
public class WordComplexityScorer {

    public int score(List<Syllable> syllables) {
        return breakdown(syllables).total();
    }

    public WordComplexity breakdown(List<Syllable> syllables) {
        if (syllables == null || syllables.isEmpty()) {
            throw new IllegalArgumentException("Word complexity needs at least one syllable");
        }

        // Word patterns
        int polysyllabic = syllables.size() > 2 ? 1 : 0;
        int nonInitialStress = hasNonInitialPrimaryStress(syllables) ? 1 : 0;

        // Syllable structures
        int finalConsonant = syllables.get(syllables.size() - 1).coda().isEmpty() ? 0 : 1;
        int onsetClusters = 0;
        int codaClusters = 0;
        for (Syllable syllable : syllables) {
            if (syllable.onset().size() > 1) {
                onsetClusters++;
            }
            if (syllable.coda().size() > 1) {
                codaClusters++;
            }
        }

        // Sound classes
        int dorsals = 0;
        int liquids = 0;
        int fricatives = 0;
        int voicedFricatives = 0;
        for (Syllable syllable : syllables) {
            List<Phoneme> consonants = syllable.margins();
            dorsals += count(consonants, PhonemeInventory::isDorsal);
            liquids += count(consonants, PhonemeInventory::isLiquid);
            fricatives += count(consonants, PhonemeInventory::isFricativeOrAffricate);
            voicedFricatives += count(consonants, PhonemeInventory::isVoicedFricativeOrAffricate);
        }

        return new WordComplexity(polysyllabic, nonInitialStress, finalConsonant,
                onsetClusters, codaClusters, dorsals, liquids, fricatives, voicedFricatives);
    }

    // Only the leading nucleus phoneme is inspected, which is a borrowed Y when one was attached
    private static boolean hasNonInitialPrimaryStress(List<Syllable> syllables) {
        if (syllables.size() < 2) {
            return false;
        }
        return syllables.subList(1, syllables.size()).stream()
                .anyMatch(s -> s.nucleus().get(0).stress() == Stress.PRIMARY);
    }

    private static int count(List<Phoneme> phonemes, Predicate<Phoneme> matcher) {
        return (int) phonemes.stream().filter(matcher).count();
    }
}
