package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.dto.SourceVideo;
import com.example.summarizer_backend.dto.selection.SelectionRequest;

import java.util.UUID;

/**
 * Everything a strategy gets for one run.
 *
 * @param jobId      owning job, for logging.
 * @param source     probed source video.
 * @param request    validated selection request.
 * @param checkpoint progress and cancellation hooks of the job.
 */
public record SelectionContext(UUID jobId, SourceVideo source, SelectionRequest request, JobCheckpoint checkpoint) {
}
