package com.wordcomplexity.domain.phonology.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhonemeTest {

    @Test
    void parses_vowel_stress() {
        assertThat(Phoneme.of("AE1")).isEqualTo(new Phoneme("AE", Stress.PRIMARY));
        assertThat(Phoneme.of("ER0")).isEqualTo(new Phoneme("ER", Stress.UNSTRESSED));
        assertThat(Phoneme.of("OW2")).isEqualTo(new Phoneme("OW", Stress.SECONDARY));
        assertThat(Phoneme.of("UW")).isEqualTo(new Phoneme("UW", Stress.UNMARKED));
    }

    @Test
    void other_tokens_kept_whole() {
        assertThat(Phoneme.of("TH")).isEqualTo(new Phoneme("TH", Stress.UNMARKED));
        assertThat(Phoneme.of("AH3").symbol()).isEqualTo("AH3");
        assertThat(Phoneme.of("T1").symbol()).isEqualTo("T1");
    }

    @Test
    void renders_original_token() {
        assertThat(Phoneme.of("AY2").arpabet()).isEqualTo("AY2");
        assertThat(Phoneme.of("NG")).hasToString("NG");
    }

    @Test
    void destressed_drops_digit() {
        assertThat(Phoneme.of("IH1").destressed()).isEqualTo(Phoneme.of("IH"));
        assertThat(Phoneme.of("K").destressed()).isEqualTo(Phoneme.of("K"));
    }

    @Test
    void stress_and_symbol_both_matter() {
        assertThat(Phoneme.of("AH0")).isNotEqualTo(Phoneme.of("AH1"));
        assertThat(Phoneme.of("S").is("S")).isTrue();
        assertThat(Phoneme.of("AH1").is("AH")).isFalse();
    }

    @Test
    void blank_rejected() {
        assertThatThrownBy(() -> Phoneme.of("  ")).isInstanceOf(IllegalArgumentException.class);
    }
}
