package com.wordcomplexity.infrastructure.lexicon;

import com.wordcomplexity.domain.lexicon.repository.PronunciationLexicon;
import com.wordcomplexity.domain.phonology.model.Phoneme;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory lexicon read once from a CMU Pronouncing Dictionary file.
 * <p>
 * Line format: {@code WORD  PH1 PH2 ...}. Lines starting with {@code ;;;} are comments.
 * Alternate pronunciations repeat the word with a numeric suffix, e.g. {@code HELLO(1)}.
 * </p>
 */
@Slf4j
@Component
public class CmuDictLexicon implements PronunciationLexicon {

    private static final String COMMENT_PREFIX = ";;;";

    // Captures group 1: headword, group 2: rest of the line
    private static final Pattern ENTRY = Pattern.compile("^(\\S+?)(?:\\(\\d+\\))?\\s+(.+)$");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, List<List<Phoneme>>> entries;
    private final List<String> words;
    private final Random random;

    @Autowired
    public CmuDictLexicon(@Value("${wcm.lexicon.location:classpath:lexicon/cmudict-sample.dict}") Resource location) {
        this(location, new Random());
    }

    public CmuDictLexicon(Resource location, Random random) {
        this.random = random;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(location.getInputStream(), StandardCharsets.UTF_8))) {
            this.entries = Collections.unmodifiableMap(read(reader));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load pronunciation lexicon from " + location, e);
        }
        this.words = List.copyOf(entries.keySet());
        log.info("Loaded {} words from pronunciation lexicon {}", words.size(), location.getDescription());
    }

    @Override
    public List<List<Phoneme>> lookup(String word) {
        if (word == null || word.isBlank()) {
            return List.of();
        }
        return entries.getOrDefault(normalize(word), List.of());
    }

    @Override
    public boolean contains(String word) {
        return word != null && entries.containsKey(normalize(word));
    }

    @Override
    public int size() {
        return words.size();
    }

    @Override
    public List<String> randomWords(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Word count must not be negative");
        }
        if (count > words.size()) {
            throw new IllegalArgumentException(String.format(
                    "Requested %d words but the lexicon holds only %d", count, words.size()));
        }
        List<String> shuffled = new ArrayList<>(words);
        synchronized (random) {
            Collections.shuffle(shuffled, random);
        }
        return List.copyOf(shuffled.subList(0, count));
    }

    // ===== Internal methods =====

    private static Map<String, List<List<Phoneme>>> read(BufferedReader reader) throws IOException {
        Map<String, List<List<Phoneme>>> result = new LinkedHashMap<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }

            Matcher matcher = ENTRY.matcher(trimmed);
            if (!matcher.matches()) {
                log.warn("Skipping malformed lexicon line {}: '{}'", lineNumber, trimmed);
                continue;
            }

            List<Phoneme> pronunciation = Arrays.stream(WHITESPACE.split(matcher.group(2).trim()))
                    .map(Phoneme::of)
                    .toList();
            result.computeIfAbsent(normalize(matcher.group(1)), k -> new ArrayList<>()).add(pronunciation);
        }
        result.replaceAll((word, prons) -> List.copyOf(prons));
        return result;
    }

    private static String normalize(String word) {
        return word.trim().toLowerCase(Locale.ROOT);
    }
}
