package com.wordcomplexity.application.analysis.exception;

public class WordNotFoundException extends RuntimeException {
    public WordNotFoundException(String word) {
        super(String.format("'%s' was not found in the pronunciation lexicon.", word));
    }
}
