package com.example.summarizer_backend.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Scene selection strategies a summary can be requested with.
 */
public enum SelectionMode {
    TEXT_PROMPT("text-prompt"),
    CATEGORY("category"),
    TIME_RANGE("time-range");

    private final String wireName;

    SelectionMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean usesEmbeddings() {
        return this != TIME_RANGE;
    }

    public static Optional<SelectionMode> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.wireName.equals(normalized) || m.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
