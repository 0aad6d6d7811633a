package com.example.summarizer_backend.dto;

/**
 * Contiguous interval of the source that is a candidate for the summary.
 *
 * @param startMs      start offset in milliseconds (inclusive).
 * @param endMs        end offset in milliseconds (exclusive).
 * @param confidence   aggregate similarity of the interval in {@code [0, 1]}.
 * @param matchedLabel prompt, category id or range label the scene matched, may be {@code null}.
 */
public record SceneCandidate(long startMs, long endMs, double confidence, String matchedLabel) {

    public SceneCandidate {
        if (startMs < 0 || endMs <= startMs) {
            throw new IllegalArgumentException("Invalid scene range: startMs=" + startMs + ", endMs=" + endMs);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
    }

    public long durationMs() {
        return endMs - startMs;
    }

    public boolean overlaps(SceneCandidate other) {
        return startMs < other.endMs && other.startMs < endMs;
    }

    public SceneCandidate withEnd(long newEndMs) {
        return new SceneCandidate(startMs, newEndMs, confidence, matchedLabel);
    }
}
