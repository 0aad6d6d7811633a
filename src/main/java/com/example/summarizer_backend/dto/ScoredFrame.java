package com.example.summarizer_backend.dto;

/**
 * Similarity of one sampled frame against the selection query.
 *
 * @param timestampMs position in milliseconds.
 * @param score       similarity in {@code [0, 1]}.
 */
public record ScoredFrame(long timestampMs, double score) {
}
