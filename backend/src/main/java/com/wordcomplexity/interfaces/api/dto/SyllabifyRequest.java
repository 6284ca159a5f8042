package com.wordcomplexity.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SyllabifyRequest(
        @NotBlank(message = "Pronunciation is required")
        @Size(max = 200, message = "Pronunciation must not exceed 200 characters")
        String pronunciation,

        Boolean alaskaRule
) {
    public boolean alaskaRuleOrDefault() {
        return alaskaRule == null || alaskaRule;
    }
}
