package com.example.summarizer_backend.catalog;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only lookup over {@link SummaryCategory}.
 */
@Component
public class CategoryCatalog {

    public List<SummaryCategory> list() {
        return List.of(SummaryCategory.values());
    }

    public Optional<SummaryCategory> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(SummaryCategory.values())
                .filter(c -> c.id().equals(normalized))
                .findFirst();
    }

    public List<String> ids() {
        return Arrays.stream(SummaryCategory.values()).map(SummaryCategory::id).toList();
    }
}
