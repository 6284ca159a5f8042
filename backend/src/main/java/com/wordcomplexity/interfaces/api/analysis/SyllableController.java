package com.wordcomplexity.interfaces.api.analysis;

import com.wordcomplexity.application.analysis.WordAnalysisService;
import com.wordcomplexity.interfaces.api.dto.BatchAnalysisResponse;
import com.wordcomplexity.interfaces.api.dto.BatchSyllabifyRequest;
import com.wordcomplexity.interfaces.api.dto.SyllabifyRequest;
import com.wordcomplexity.interfaces.api.dto.WordAnalysisResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/syllables")
@RequiredArgsConstructor
public class SyllableController {

    private final WordAnalysisService wordAnalysisService;

    @Value("${wcm.lexicon.random-default-count:10}")
    private int randomDefaultCount;

    @PostMapping
    public ResponseEntity<WordAnalysisResponse> syllabify(@Valid @RequestBody SyllabifyRequest request) {
        return ResponseEntity.ok(WordAnalysisResponse.from(
                wordAnalysisService.analyze(request.pronunciation(), request.alaskaRuleOrDefault())));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchAnalysisResponse> syllabifyBatch(@Valid @RequestBody BatchSyllabifyRequest request) {
        return ResponseEntity.ok(BatchAnalysisResponse.from(
                wordAnalysisService.analyzeBatch(request.pronunciations(), request.alaskaRuleOrDefault())));
    }

    @GetMapping("/words/random")
    public ResponseEntity<List<WordAnalysisResponse>> randomWords(
            @RequestParam(required = false) Integer count,
            @RequestParam(defaultValue = "true") boolean alaskaRule) {
        int n = count != null ? count : randomDefaultCount;
        return ResponseEntity.ok(wordAnalysisService.sampleWords(n, alaskaRule).stream()
                .map(WordAnalysisResponse::from)
                .toList());
    }

    @GetMapping("/words/{word}")
    public ResponseEntity<List<WordAnalysisResponse>> word(
            @PathVariable String word,
            @RequestParam(defaultValue = "true") boolean alaskaRule) {
        return ResponseEntity.ok(wordAnalysisService.analyzeWord(word, alaskaRule).stream()
                .map(WordAnalysisResponse::from)
                .toList());
    }
}
