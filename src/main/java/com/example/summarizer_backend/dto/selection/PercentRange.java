package com.example.summarizer_backend.dto.selection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Relative range of the source, both ends in percent of its duration.
 */
public record PercentRange(@JsonProperty("start_percent") double startPercent,
                           @JsonProperty("end_percent") double endPercent) {

    public String label() {
        return String.format(Locale.ROOT, "%.1f%%-%.1f%%", startPercent, endPercent);
    }
}
