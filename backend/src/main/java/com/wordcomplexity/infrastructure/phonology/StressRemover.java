package com.wordcomplexity.infrastructure.phonology;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Strips stress digits from syllable nuclei. Onsets and codas are left as they are.
 */
@Component
public class StressRemover {

    public List<Syllable> destress(List<Syllable> syllables) {
        return syllables.stream()
                .map(s -> new Syllable(
                        s.onset(),
                        s.nucleus().stream().map(Phoneme::destressed).toList(),
                        s.coda()))
                .toList();
    }
}
