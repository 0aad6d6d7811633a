package com.example.summarizer_backend.dto.web;

import com.example.summarizer_backend.dto.SceneCandidate;

public record SceneResponse(long startMs, long endMs, long durationMs, double confidence, String matchedLabel) {

    public static SceneResponse of(SceneCandidate c) {
        return new SceneResponse(c.startMs(), c.endMs(), c.durationMs(), c.confidence(), c.matchedLabel());
    }
}
