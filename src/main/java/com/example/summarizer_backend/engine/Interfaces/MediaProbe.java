package com.example.summarizer_backend.engine.Interfaces;

import com.example.summarizer_backend.dto.SourceVideo;

import java.nio.file.Path;

public interface MediaProbe {

    /**
     * Reads container and stream metadata of a local media file.
     *
     * @throws com.example.summarizer_backend.exception.ResourceException when the file is missing,
     *         has no video stream or cannot be parsed.
     */
    SourceVideo probe(Path file);
}
