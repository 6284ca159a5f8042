package com.wordcomplexity.infrastructure.phonology;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Stress;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static classification tables over the ARPABET inventory.
 * All sets are immutable and shared by every syllabification.
 */
public final class PhonemeInventory {

    private static final List<String> VOWEL_ROOTS = List.of(
            "IY", "EY", "AA", "ER", "AW", "AO", "AY", "OW", "OY",
            "IH", "EH", "AE", "AH", "UH", "UW"
    );

    // Lax vowel roots; only their stressed forms trigger the Alaska rule
    private static final List<String> LAX_ROOTS = List.of("IH", "EH", "AE", "AH", "UH");

    /** Every vowel root with each stress variant, bare form included. */
    public static final Set<Phoneme> VOWELS = crossWithStress(VOWEL_ROOTS,
            Stress.UNMARKED, Stress.UNSTRESSED, Stress.PRIMARY, Stress.SECONDARY);

    public static final Set<Phoneme> LAX_VOWELS = crossWithStress(LAX_ROOTS,
            Stress.PRIMARY, Stress.SECONDARY);

    // Licit medial onsets
    public static final Set<List<String>> ONSETS_2 = Set.of(
            List.of("P", "R"), List.of("T", "R"), List.of("K", "R"), List.of("B", "R"),
            List.of("D", "R"), List.of("G", "R"), List.of("F", "R"), List.of("TH", "R"),
            List.of("P", "L"), List.of("K", "L"), List.of("B", "L"), List.of("G", "L"),
            List.of("F", "L"), List.of("S", "L"),
            List.of("K", "W"), List.of("G", "W"), List.of("S", "W"),
            List.of("S", "P"), List.of("S", "T"), List.of("S", "K"),
            List.of("HH", "Y"), // clerihew
            List.of("R", "W")
    );

    public static final Set<List<String>> ONSETS_3 = Set.of(
            List.of("S", "T", "R"), List.of("S", "K", "L"),
            List.of("T", "R", "W") // octroi
    );

    // Word Complexity Measure sound classes
    public static final Set<String> DORSALS = Set.of("K", "G", "NG");
    public static final Set<String> LIQUIDS = Set.of("L", "R");
    public static final Set<String> VOICED_FRICATIVES_AFFRICATES = Set.of("V", "DH", "Z", "ZH");
    public static final Set<String> FRICATIVES_AFFRICATES = union(
            Set.of("F", "TH", "S", "SH", "CH"), VOICED_FRICATIVES_AFFRICATES);

    private PhonemeInventory() {
    }

    public static boolean isVowel(Phoneme phoneme) {
        return VOWELS.contains(phoneme);
    }

    public static boolean isLaxVowel(Phoneme phoneme) {
        return LAX_VOWELS.contains(phoneme);
    }

    public static boolean isLegalOnset(List<Phoneme> cluster) {
        List<String> symbols = symbols(cluster);
        return switch (symbols.size()) {
            case 1 -> true;
            case 2 -> ONSETS_2.contains(symbols);
            case 3 -> ONSETS_3.contains(symbols);
            default -> false;
        };
    }

    public static boolean isDorsal(Phoneme phoneme) {
        return isConsonantIn(phoneme, DORSALS);
    }

    public static boolean isLiquid(Phoneme phoneme) {
        return isConsonantIn(phoneme, LIQUIDS);
    }

    public static boolean isFricativeOrAffricate(Phoneme phoneme) {
        return isConsonantIn(phoneme, FRICATIVES_AFFRICATES);
    }

    public static boolean isVoicedFricativeOrAffricate(Phoneme phoneme) {
        return isConsonantIn(phoneme, VOICED_FRICATIVES_AFFRICATES);
    }

    private static boolean isConsonantIn(Phoneme phoneme, Set<String> table) {
        return phoneme.stress() == Stress.UNMARKED && table.contains(phoneme.symbol());
    }

    private static List<String> symbols(List<Phoneme> cluster) {
        return cluster.stream()
                .map(p -> p.stress() == Stress.UNMARKED ? p.symbol() : p.arpabet())
                .toList();
    }

    private static Set<Phoneme> crossWithStress(List<String> roots, Stress... stresses) {
        Set<Phoneme> result = new HashSet<>();
        for (String root : roots) {
            for (Stress stress : stresses) {
                result.add(new Phoneme(root, stress));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> result = new HashSet<>(a);
        result.addAll(b);
        return Set.copyOf(result);
    }
}
