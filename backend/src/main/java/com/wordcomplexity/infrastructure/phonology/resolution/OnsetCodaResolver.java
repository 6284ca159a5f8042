package com.wordcomplexity.infrastructure.phonology.resolution;

import com.wordcomplexity.domain.phonology.exception.InvalidInputException;
import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.infrastructure.phonology.PhonemeInventory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits every medial consonant run into the coda of the preceding syllable
 * and the onset of the following one.
 * <p>
 * Rules, applied in order to each medial onset:
 * <ol>
 *   <li>a leading R joins the preceding nucleus</li>
 *   <li>a trailing Y after two or more consonants joins the following nucleus</li>
 *   <li>Alaska rule: a leading S after a stressed lax vowel closes the preceding syllable</li>
 *   <li>onset maximization against the legal two- and three-consonant clusters</li>
 * </ol>
 * The nucleus and onset lists are modified in place.
 */
@Slf4j
@Component
public class OnsetCodaResolver {

    private static final String RHOTIC = "R";
    private static final String GLIDE = "Y";
    private static final String SIBILANT = "S";

    public ResolvedBoundaries resolve(List<List<Phoneme>> nuclei,
                                      List<List<Phoneme>> onsets,
                                      boolean alaskaRule) {
        if (nuclei == null || onsets == null || nuclei.isEmpty() || onsets.isEmpty()) {
            throw new InvalidInputException("Nuclei and onsets must both be non-empty");
        }
        if (nuclei.size() != onsets.size()) {
            throw new InvalidInputException(String.format(
                    "Got %d nuclei but %d onsets", nuclei.size(), onsets.size()));
        }

        List<List<Phoneme>> codas = new ArrayList<>();
        for (int i = 0; i < onsets.size(); i++) {
            codas.add(new ArrayList<>());
        }

        for (int i = 1; i < onsets.size(); i++) {
            List<Phoneme> onset = onsets.get(i);
            List<Phoneme> coda = codas.get(i - 1);

            if (onset.size() > 1 && onset.get(0).is(RHOTIC)) {
                nuclei.get(i - 1).add(onset.remove(0));
            }
            if (onset.size() > 2 && onset.get(onset.size() - 1).is(GLIDE)) {
                nuclei.get(i).add(0, onset.remove(onset.size() - 1));
            }
            if (alaskaRule
                    && onset.size() > 1
                    && PhonemeInventory.isLaxVowel(last(nuclei.get(i - 1)))
                    && onset.get(0).is(SIBILANT)) {
                coda.add(onset.remove(0));
                log.debug("Alaska rule closed syllable {} with S", i - 1);
            }

            int depth = onsetDepth(onset);
            while (onset.size() > depth) {
                coda.add(onset.remove(0));
            }
        }

        return new ResolvedBoundaries(onsets, codas);
    }

    /**
     * Longest legal onset that can be kept at the end of this cluster: 1, 2 or 3.
     * The three-consonant table is consulted only when the final pair is already legal.
     */
    int onsetDepth(List<Phoneme> onset) {
        int depth = 1;
        if (onset.size() >= 2 && PhonemeInventory.isLegalOnset(suffix(onset, 2))) {
            depth = 2;
            if (onset.size() >= 3 && PhonemeInventory.isLegalOnset(suffix(onset, 3))) {
                depth = 3;
            }
        }
        return depth;
    }

    private static List<Phoneme> suffix(List<Phoneme> list, int length) {
        return list.subList(list.size() - length, list.size());
    }

    private static Phoneme last(List<Phoneme> list) {
        return list.get(list.size() - 1);
    }
}
