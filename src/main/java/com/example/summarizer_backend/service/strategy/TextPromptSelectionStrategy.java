package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.aggregate.SceneAggregator;
import com.example.summarizer_backend.dto.selection.SelectionRequest;
import com.example.summarizer_backend.dto.selection.TextPromptRequest;
import com.example.summarizer_backend.embedding.EmbeddingEngine;
import com.example.summarizer_backend.sampler.FrameSampler;
import com.example.summarizer_backend.selector.SceneSelector;
import com.example.summarizer_backend.selector.SelectorConfig;
import com.example.summarizer_backend.util.SelectionMode;
import org.springframework.stereotype.Component;

@Component
public class TextPromptSelectionStrategy extends EmbeddingSelectionStrategy {

    public TextPromptSelectionStrategy(FrameSampler sampler,
                                       EmbeddingEngine embeddingEngine,
                                       SceneAggregator aggregator,
                                       SceneSelector selector,
                                       SelectorConfig selectorConfig) {
        super(sampler, embeddingEngine, aggregator, selector, selectorConfig);
    }

    @Override
    public SelectionMode mode() {
        return SelectionMode.TEXT_PROMPT;
    }

    @Override
    protected float[] queryVector(SelectionRequest request) {
        return embeddingEngine.embedText(((TextPromptRequest) request).prompt());
    }

    @Override
    protected String label(SelectionRequest request) {
        return ((TextPromptRequest) request).prompt();
    }
}
