package com.wordcomplexity.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
