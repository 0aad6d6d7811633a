package com.example.summarizer_backend.dto;

import java.nio.file.Path;

/**
 * Output of a successful composition inside the job workspace.
 *
 * @param file         composed artifact, still inside the job workspace.
 * @param sizeBytes    artifact size in bytes.
 * @param streamCopied {@code true} when every interval was cut without re-encoding.
 */
public record ComposeResult(Path file, long sizeBytes, boolean streamCopied) {
}
