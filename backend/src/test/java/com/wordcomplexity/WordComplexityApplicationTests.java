package com.wordcomplexity;

import com.wordcomplexity.application.analysis.WordAnalysis;
import com.wordcomplexity.application.analysis.WordAnalysisService;
import com.wordcomplexity.domain.lexicon.repository.PronunciationLexicon;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class WordComplexityApplicationTests {

    @Autowired
    private WordAnalysisService wordAnalysisService;

    @Autowired
    private PronunciationLexicon lexicon;

    @Test
    void bundled_lexicon_is_wired() {
        assertThat(lexicon.contains("alaska")).isTrue();

        List<WordAnalysis> results = wordAnalysisService.analyzeWord("alaska", true);

        assertThat(results).singleElement()
                .satisfies(a -> assertThat(a.syllabified()).isEqualTo("AH0.L-AE1-S.K-AH0"));
    }

    @Test
    void every_bundled_word_but_psst_syllabifies() {
        for (String word : lexicon.randomWords(lexicon.size())) {
            List<WordAnalysis> results = wordAnalysisService.analyzeWord(word, true);
            if ("psst".equals(word)) {
                assertThat(results).isEmpty();
            } else {
                assertThat(results).as(word).isNotEmpty();
            }
        }
    }
}
