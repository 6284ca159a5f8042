package com.wordcomplexity.domain.phonology.model;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable ARPABET segment.
 *
 * @param symbol the segment without its stress digit, e.g. "AE" or "TH"
 * @param stress stress level; always {@link Stress#UNMARKED} for consonants
 */
public record Phoneme(String symbol, Stress stress) {

    // Roots that may carry a stress digit
    private static final Set<String> VOWEL_ROOTS = Set.of(
            "IY", "EY", "AA", "ER", "AW", "AO", "AY", "OW", "OY",
            "IH", "EH", "AE", "AH", "UH", "UW"
    );

    public Phoneme {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(stress, "stress");
        if (symbol.isBlank()) {
            throw new IllegalArgumentException("Phoneme symbol must not be blank");
        }
    }

    /**
     * Parse a single ARPABET token. A trailing 0/1/2 is read as stress only
     * when what precedes it is a vowel root; any other token is kept whole.
     */
    public static Phoneme of(String token) {
        Objects.requireNonNull(token, "token");
        String t = token.trim();
        int last = t.length() - 1;
        if (last > 0 && Stress.isStressDigit(t.charAt(last)) && VOWEL_ROOTS.contains(t.substring(0, last))) {
            return new Phoneme(t.substring(0, last), Stress.fromDigit(t.charAt(last)));
        }
        return new Phoneme(t, Stress.UNMARKED);
    }

    public boolean is(String bareSymbol) {
        return stress == Stress.UNMARKED && symbol.equals(bareSymbol);
    }

    public Phoneme destressed() {
        return stress == Stress.UNMARKED ? this : new Phoneme(symbol, Stress.UNMARKED);
    }

    public String arpabet() {
        return symbol + stress.suffix();
    }

    @Override
    public String toString() {
        return arpabet();
    }
}
