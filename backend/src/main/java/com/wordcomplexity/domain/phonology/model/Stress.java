package com.wordcomplexity.domain.phonology.model;

/**
 * Lexical stress carried by an ARPABET vowel.
 * Consonants and legacy bare vowels are {@link #UNMARKED}.
 */
public enum Stress {
    UNMARKED(null),
    UNSTRESSED('0'),
    PRIMARY('1'),
    SECONDARY('2');

    private final Character digit;

    Stress(Character digit) {
        this.digit = digit;
    }

    /**
     * @return the ARPABET suffix digit, or {@code ""} for {@link #UNMARKED}
     */
    public String suffix() {
        return digit == null ? "" : String.valueOf(digit);
    }

    public static Stress fromDigit(char c) {
        return switch (c) {
            case '0' -> UNSTRESSED;
            case '1' -> PRIMARY;
            case '2' -> SECONDARY;
            default -> throw new IllegalArgumentException("Not a stress digit: " + c);
        };
    }

    public static boolean isStressDigit(char c) {
        return c == '0' || c == '1' || c == '2';
    }
}
