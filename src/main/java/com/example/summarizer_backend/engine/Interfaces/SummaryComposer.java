package com.example.summarizer_backend.engine.Interfaces;

import com.example.summarizer_backend.dto.ComposeResult;
import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.SourceVideo;

import java.nio.file.Path;
import java.util.List;

public interface SummaryComposer {

    /**
     * Cuts {@code scenes} out of the source and concatenates them, in order, into one file.
     *
     * @param source       probed source video.
     * @param scenes       non-overlapping intervals sorted by start.
     * @param workDir      job-scoped scratch directory; the caller owns its cleanup.
     * @param outputFormat container extension of the artifact (e.g. {@code mp4}).
     * @return the composed file inside {@code workDir}.
     * @throws com.example.summarizer_backend.exception.ComposeException when extraction or concatenation
     *         fails after the configured retries.
     */
    ComposeResult compose(SourceVideo source, List<SceneCandidate> scenes, Path workDir, String outputFormat);
}
