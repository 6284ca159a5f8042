package com.wordcomplexity.infrastructure.phonology;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts between ARPABET text and phoneme/syllable values.
 */
@Component
public class SyllableFormatter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Render syllables as e.g. {@code AH0.L-AE1-S.K-AH0}: phonemes space-joined,
     * non-empty onset/nucleus/coda hyphen-joined, syllables period-joined.
     */
    public String prettyPrint(List<Syllable> syllables) {
        return syllables.stream()
                .map(this::render)
                .collect(Collectors.joining("."));
    }

    /**
     * Split whitespace-separated ARPABET text into phonemes. Blank input gives an empty list.
     */
    public List<Phoneme> parse(String pronunciation) {
        if (pronunciation == null || pronunciation.isBlank()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(pronunciation.trim()))
                .map(Phoneme::of)
                .toList();
    }

    public String join(List<Phoneme> phonemes) {
        return phonemes.stream()
                .map(Phoneme::arpabet)
                .collect(Collectors.joining(" "));
    }

    private String render(Syllable syllable) {
        List<String> parts = new ArrayList<>(3);
        for (List<Phoneme> part : List.of(syllable.onset(), syllable.nucleus(), syllable.coda())) {
            if (!part.isEmpty()) {
                parts.add(join(part));
            }
        }
        return String.join("-", parts);
    }
}
