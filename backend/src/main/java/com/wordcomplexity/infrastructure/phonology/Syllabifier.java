package com.wordcomplexity.infrastructure.phonology;

import com.wordcomplexity.domain.phonology.exception.SyllabificationException;
import com.wordcomplexity.domain.phonology.model.Phoneme;
import com.wordcomplexity.domain.phonology.model.Syllable;
import com.wordcomplexity.domain.phonology.service.SyllabificationService;
import com.wordcomplexity.infrastructure.phonology.resolution.OnsetCodaResolver;
import com.wordcomplexity.infrastructure.phonology.resolution.ResolvedBoundaries;
import com.wordcomplexity.infrastructure.phonology.segmentation.NucleusOnsetSegmenter;
import com.wordcomplexity.infrastructure.phonology.segmentation.SegmentationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates syllabification of a single ARPABET pronunciation:
 * <p>
 * segment → resolve onsets/codas → assemble → round-trip check
 * </p>
 * The round-trip check is the only guarantee that the resolution rules
 * neither dropped nor duplicated a phoneme, so it always runs.
 */
@Slf4j
@Component
public class Syllabifier implements SyllabificationService {

    private final NucleusOnsetSegmenter segmenter;
    private final OnsetCodaResolver resolver;
    private final boolean defaultAlaskaRule;

    public Syllabifier(NucleusOnsetSegmenter segmenter,
                       OnsetCodaResolver resolver,
                       @Value("${wcm.syllabifier.alaska-rule:true}") boolean defaultAlaskaRule) {
        this.segmenter = segmenter;
        this.resolver = resolver;
        this.defaultAlaskaRule = defaultAlaskaRule;
    }

    @Override
    public List<Syllable> syllabify(List<Phoneme> pronunciation) {
        return syllabify(pronunciation, defaultAlaskaRule);
    }

    @Override
    public List<Syllable> syllabify(List<Phoneme> pronunciation, boolean alaskaRule) {
        SyllabificationContext ctx = new SyllabificationContext();
        ctx.setPronunciation(List.copyOf(pronunciation));
        ctx.setAlaskaRule(alaskaRule);

        // 1. Nuclei and raw onsets
        segment(ctx);

        // 2. Onset/coda boundaries (nothing to resolve without a nucleus)
        if (!ctx.getNuclei().isEmpty()) {
            resolve(ctx);
        }

        // 3. Syllable records
        assemble(ctx);

        // 4. Round-trip check
        validate(ctx);

        log.debug("Syllabified {} into {} syllables (alaskaRule={})",
                ctx.getPronunciation(), ctx.getSyllables().size(), alaskaRule);
        return ctx.getSyllables();
    }

    // ===== Internal methods =====

    private void segment(SyllabificationContext ctx) {
        SegmentationResult result = segmenter.segment(ctx.getPronunciation());
        ctx.setNuclei(result.nuclei());
        ctx.setOnsets(result.onsets());
        ctx.setTail(result.tail());
    }

    private void resolve(SyllabificationContext ctx) {
        ResolvedBoundaries boundaries = resolver.resolve(ctx.getNuclei(), ctx.getOnsets(), ctx.isAlaskaRule());
        ctx.setOnsets(boundaries.onsets());
        ctx.setCodas(boundaries.codas());
    }

    private void assemble(SyllabificationContext ctx) {
        List<List<Phoneme>> onsets = ctx.getOnsets();
        List<List<Phoneme>> nuclei = ctx.getNuclei();
        List<List<Phoneme>> codas = ctx.getCodas();
        int count = nuclei.size();
        if (count == 0) {
            return;
        }

        List<Syllable> syllables = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            List<Phoneme> coda = new ArrayList<>(codas.get(i));
            if (i == count - 1) {
                coda.addAll(ctx.getTail());
            }
            syllables.add(new Syllable(onsets.get(i), nuclei.get(i), coda));
        }
        ctx.setSyllables(syllables);
    }

    private void validate(SyllabificationContext ctx) {
        List<Phoneme> flat = ctx.flatten();
        if (!flat.equals(ctx.getPronunciation())) {
            log.warn("Round-trip mismatch: input={}, syllabified={}", ctx.getPronunciation(), flat);
            throw new SyllabificationException(ctx.getPronunciation(), flat);
        }
    }
}
