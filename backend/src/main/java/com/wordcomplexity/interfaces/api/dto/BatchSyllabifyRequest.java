package com.wordcomplexity.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchSyllabifyRequest(
        @NotEmpty(message = "At least one pronunciation is required")
        List<String> pronunciations,

        Boolean alaskaRule
) {
    public boolean alaskaRuleOrDefault() {
        return alaskaRule == null || alaskaRule;
    }
}
