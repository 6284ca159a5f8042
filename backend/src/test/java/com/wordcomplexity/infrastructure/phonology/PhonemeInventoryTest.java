package com.wordcomplexity.infrastructure.phonology;

import com.wordcomplexity.domain.phonology.model.Phoneme;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.wordcomplexity.infrastructure.phonology.PhonemeFixtures.phonemes;
import static org.assertj.core.api.Assertions.assertThat;

class PhonemeInventoryTest {

    @Test
    @DisplayName("Fifteen roots with four forms each")
    void vowel_inventory() {
        assertThat(PhonemeInventory.VOWELS).hasSize(60);
        assertThat(PhonemeInventory.isVowel(Phoneme.of("UW"))).isTrue();
        assertThat(PhonemeInventory.isVowel(Phoneme.of("ER2"))).isTrue();
        assertThat(PhonemeInventory.isVowel(Phoneme.of("AH3"))).isFalse();
        assertThat(PhonemeInventory.isVowel(Phoneme.of("Y"))).isFalse();
    }

    @Test
    @DisplayName("Only stressed lax vowels are lax")
    void lax_vowels() {
        assertThat(PhonemeInventory.LAX_VOWELS).hasSize(10);
        assertThat(PhonemeInventory.isLaxVowel(Phoneme.of("AE1"))).isTrue();
        assertThat(PhonemeInventory.isLaxVowel(Phoneme.of("UH2"))).isTrue();
        assertThat(PhonemeInventory.isLaxVowel(Phoneme.of("AE0"))).isFalse();
        assertThat(PhonemeInventory.isLaxVowel(Phoneme.of("AE"))).isFalse();
        assertThat(PhonemeInventory.isLaxVowel(Phoneme.of("IY1"))).isFalse();
    }

    @Test
    @DisplayName("Every legal triple ends in a legal pair")
    void triples_extend_pairs() {
        for (List<String> triple : PhonemeInventory.ONSETS_3) {
            assertThat(PhonemeInventory.ONSETS_2).contains(triple.subList(1, 3));
        }
    }

    @Test
    void legal_onsets() {
        assertThat(PhonemeInventory.isLegalOnset(phonemes("T"))).isTrue();
        assertThat(PhonemeInventory.isLegalOnset(phonemes("TH R"))).isTrue();
        assertThat(PhonemeInventory.isLegalOnset(phonemes("R T"))).isFalse();
        assertThat(PhonemeInventory.isLegalOnset(phonemes("S T R"))).isTrue();
        assertThat(PhonemeInventory.isLegalOnset(phonemes("S P R"))).isFalse();
        assertThat(PhonemeInventory.isLegalOnset(phonemes("S AH0"))).isFalse();
    }

    @Test
    void sound_classes() {
        assertThat(PhonemeInventory.isDorsal(Phoneme.of("NG"))).isTrue();
        assertThat(PhonemeInventory.isLiquid(Phoneme.of("L"))).isTrue();
        assertThat(PhonemeInventory.isFricativeOrAffricate(Phoneme.of("CH"))).isTrue();
        assertThat(PhonemeInventory.isFricativeOrAffricate(Phoneme.of("ZH"))).isTrue();
        assertThat(PhonemeInventory.isVoicedFricativeOrAffricate(Phoneme.of("ZH"))).isTrue();
        assertThat(PhonemeInventory.isVoicedFricativeOrAffricate(Phoneme.of("S"))).isFalse();
    }
}
