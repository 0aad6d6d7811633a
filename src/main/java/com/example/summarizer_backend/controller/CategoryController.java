package com.example.summarizer_backend.controller;

import com.example.summarizer_backend.catalog.CategoryCatalog;
import com.example.summarizer_backend.dto.web.CategoryResponse;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/categories")
public class CategoryController {
    private final CategoryCatalog catalog;

    public CategoryController(CategoryCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    @Operation(summary = "Categories a summary can be requested for")
    public CategoryResponse.Listing list() {
        return new CategoryResponse.Listing(catalog.list().stream().map(CategoryResponse::of).toList());
    }
}
