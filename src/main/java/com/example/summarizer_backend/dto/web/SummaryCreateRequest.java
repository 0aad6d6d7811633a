package com.example.summarizer_backend.dto.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SummaryCreateRequest(
        @NotBlank String title,
        @NotBlank String sourceKey,
        @Schema(allowableValues = {"text-prompt", "category", "time-range"}) @NotBlank String mode,
        @Schema(description = "{prompt} | {category_id} | {ranges:[{start_percent,end_percent}]}") @NotNull JsonNode payload) {
}
