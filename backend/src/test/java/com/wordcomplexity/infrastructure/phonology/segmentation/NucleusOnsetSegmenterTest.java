package com.wordcomplexity.infrastructure.phonology.segmentation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.wordcomplexity.infrastructure.phonology.PhonemeFixtures.phonemes;
import static org.assertj.core.api.Assertions.assertThat;

class NucleusOnsetSegmenterTest {

    private NucleusOnsetSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new NucleusOnsetSegmenter();
    }

    @Test
    @DisplayName("Empty input has no nuclei, onsets or tail")
    void empty_input() {
        SegmentationResult result = segmenter.segment(phonemes(""));
        assertThat(result.nuclei()).isEmpty();
        assertThat(result.onsets()).isEmpty();
        assertThat(result.tail()).isEmpty();
    }

    @Test
    @DisplayName("One nucleus and one raw onset per vowel")
    void brackets_consonants_between_vowels() {
        SegmentationResult result = segmenter.segment(phonemes("EH1 K S T R AH0"));

        assertThat(result.nucleusCount()).isEqualTo(2);
        assertThat(result.nuclei()).containsExactly(phonemes("EH1"), phonemes("AH0"));
        assertThat(result.onsets()).containsExactly(phonemes(""), phonemes("K S T R"));
        assertThat(result.tail()).isEmpty();
    }

    @Test
    @DisplayName("Consonants after the last vowel form the tail")
    void trailing_consonants_form_tail() {
        SegmentationResult result = segmenter.segment(phonemes("S T R EH1 NG K TH S"));

        assertThat(result.onsets()).containsExactly(phonemes("S T R"));
        assertThat(result.tail()).isEqualTo(phonemes("NG K TH S"));
    }

    @Test
    @DisplayName("Vowelless input is entirely tail")
    void vowelless_input_is_tail() {
        SegmentationResult result = segmenter.segment(phonemes("S T R"));

        assertThat(result.nuclei()).isEmpty();
        assertThat(result.tail()).isEqualTo(phonemes("S T R"));
    }

    @Test
    @DisplayName("Bare legacy vowels are nuclei")
    void bare_vowels_are_nuclei() {
        SegmentationResult result = segmenter.segment(phonemes("K AE T"));

        assertThat(result.nuclei()).containsExactly(phonemes("AE"));
        assertThat(result.tail()).isEqualTo(phonemes("T"));
    }

    @Test
    @DisplayName("Working lists are mutable copies")
    void buffers_are_mutable() {
        SegmentationResult result = segmenter.segment(phonemes("AH0 L AE1"));

        result.onsets().get(1).clear();
        result.nuclei().get(0).add(phonemes("R").get(0));

        assertThat(result.onsets().get(1)).isEmpty();
        assertThat(result.nuclei().get(0)).hasSize(2);
    }
}
