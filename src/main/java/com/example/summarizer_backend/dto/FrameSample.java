package com.example.summarizer_backend.dto;

/**
 * Frame embedding produced during one job run. Never persisted.
 *
 * @param timestampMs position of the sampled frame in milliseconds.
 * @param embedding   L2-normalized embedding vector.
 */
public record FrameSample(long timestampMs, float[] embedding) {
}
