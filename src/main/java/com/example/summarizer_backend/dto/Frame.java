package com.example.summarizer_backend.dto;

/**
 * Decoded frame at a timestamp, kept as an encoded still image.
 *
 * @param timestampMs position in the source in milliseconds.
 * @param image       encoded image bytes (PNG).
 */
public record Frame(long timestampMs, byte[] image) {
}
