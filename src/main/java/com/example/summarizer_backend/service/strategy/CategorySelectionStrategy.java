package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.aggregate.SceneAggregator;
import com.example.summarizer_backend.dto.selection.CategoryRequest;
import com.example.summarizer_backend.dto.selection.SelectionRequest;
import com.example.summarizer_backend.embedding.EmbeddingEngine;
import com.example.summarizer_backend.sampler.FrameSampler;
import com.example.summarizer_backend.selector.SceneSelector;
import com.example.summarizer_backend.selector.SelectorConfig;
import com.example.summarizer_backend.util.SelectionMode;
import org.springframework.stereotype.Component;

/**
 * Matches against the ensemble of a category's prompt templates.
 */
@Component
public class CategorySelectionStrategy extends EmbeddingSelectionStrategy {

    public CategorySelectionStrategy(FrameSampler sampler,
                                     EmbeddingEngine embeddingEngine,
                                     SceneAggregator aggregator,
                                     SceneSelector selector,
                                     SelectorConfig selectorConfig) {
        super(sampler, embeddingEngine, aggregator, selector, selectorConfig);
    }

    @Override
    public SelectionMode mode() {
        return SelectionMode.CATEGORY;
    }

    @Override
    protected float[] queryVector(SelectionRequest request) {
        return embeddingEngine.embedPrompts(((CategoryRequest) request).category().promptTemplates());
    }

    @Override
    protected String label(SelectionRequest request) {
        return ((CategoryRequest) request).category().id();
    }
}
