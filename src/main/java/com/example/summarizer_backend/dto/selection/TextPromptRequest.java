package com.example.summarizer_backend.dto.selection;

import com.example.summarizer_backend.util.SelectionMode;

import java.util.Map;

public record TextPromptRequest(String prompt) implements SelectionRequest {

    @Override
    public SelectionMode mode() {
        return SelectionMode.TEXT_PROMPT;
    }

    @Override
    public Map<String, Object> toPayload() {
        return Map.of("prompt", prompt);
    }
}
