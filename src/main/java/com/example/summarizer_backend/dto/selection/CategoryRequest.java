package com.example.summarizer_backend.dto.selection;

import com.example.summarizer_backend.catalog.SummaryCategory;
import com.example.summarizer_backend.util.SelectionMode;

import java.util.Map;

public record CategoryRequest(SummaryCategory category) implements SelectionRequest {

    @Override
    public SelectionMode mode() {
        return SelectionMode.CATEGORY;
    }

    @Override
    public Map<String, Object> toPayload() {
        return Map.of("category_id", category.id());
    }
}
