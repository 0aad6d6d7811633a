package com.example.summarizer_backend.dto.web;

import com.example.summarizer_backend.catalog.SummaryCategory;

import java.util.List;

public record CategoryResponse(String id, String name, String description) {

    public static CategoryResponse of(SummaryCategory c) {
        return new CategoryResponse(c.id(), c.displayName(), c.description());
    }

    public record Listing(List<CategoryResponse> categories) {
    }
}
