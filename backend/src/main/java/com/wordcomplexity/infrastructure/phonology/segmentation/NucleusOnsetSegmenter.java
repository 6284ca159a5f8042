package com.wordcomplexity.infrastructure.phonology.segmentation;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.infrastructure.phonology.PhonemeInventory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds vowel nuclei and brackets the consonants between them.
 * No consonant classification happens here.
 */
@Component
public class NucleusOnsetSegmenter {

    public SegmentationResult segment(List<Phoneme> pronunciation) {
        List<List<Phoneme>> nuclei = new ArrayList<>();
        List<List<Phoneme>> onsets = new ArrayList<>();
        int lastVowelIndex = -1;

        for (int i = 0; i < pronunciation.size(); i++) {
            Phoneme segment = pronunciation.get(i);
            if (PhonemeInventory.isVowel(segment)) {
                nuclei.add(new ArrayList<>(List.of(segment)));
                onsets.add(new ArrayList<>(pronunciation.subList(lastVowelIndex + 1, i)));
                lastVowelIndex = i;
            }
        }

        List<Phoneme> tail = new ArrayList<>(pronunciation.subList(lastVowelIndex + 1, pronunciation.size()));
        return new SegmentationResult(nuclei, onsets, tail);
    }
}
