package com.example.summarizer_backend.service;

import com.example.summarizer_backend.config.ComposeProperties;
import com.example.summarizer_backend.dto.selection.SelectionRequest;
import com.example.summarizer_backend.dto.web.ProgressResponse;
import com.example.summarizer_backend.dto.web.SummaryCreateRequest;
import com.example.summarizer_backend.dto.web.SummaryResponse;
import com.example.summarizer_backend.exception.JobConflictException;
import com.example.summarizer_backend.exception.JobNotFoundException;
import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.service.Interfaces.StorageService;
import com.example.summarizer_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Caller-facing operations on summary jobs. Requests are validated here, synchronously; everything
 * after creation happens on the worker.
 */
@Service
public class SummaryJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryJobService.class);

    private final SummaryJobStore store;
    private final SelectionRequestParser parser;
    private final StorageService storage;
    private final WorkerService worker;
    private final String outputFormat;

    public SummaryJobService(SummaryJobStore store,
                             SelectionRequestParser parser,
                             StorageService storage,
                             WorkerService worker,
                             ComposeProperties composeProperties) {
        this.store = store;
        this.parser = parser;
        this.storage = storage;
        this.worker = worker;
        this.outputFormat = composeProperties.getOutputFormat().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws com.example.summarizer_backend.exception.ValidationException when the request is malformed;
     *         no job is created in that case.
     */
    public ProgressResponse create(SummaryCreateRequest req) {
        String title = parser.validateTitle(req.title());
        String sourceKey = parser.validateSourceKey(req.sourceKey());
        SelectionRequest selection = parser.parse(req.mode(), req.payload());
        SummaryJob job = store.create(title, sourceKey, selection, outputFormat);
        LOGGER.info("SUMMARY CREATE jobId={} mode={} source={}", job.getId(), selection.mode().wireName(), sourceKey);
        startIfIdle(job.getId());
        return ProgressResponse.of(job);
    }

    /** Skips the poll delay when a worker slot is free; otherwise the poller picks the job up. */
    private void startIfIdle(UUID id) {
        if (!worker.hasIdleSlot()) {
            return;
        }
        try {
            worker.dispatch(id);
        } catch (JobConflictException e) {
            LOGGER.debug("SUMMARY DISPATCH jobId={} left to poller: {}", id, e.getMessage());
        }
    }

    public ProgressResponse progress(UUID id) {
        return ProgressResponse.of(load(id));
    }

    public SummaryResponse result(UUID id) {
        return SummaryResponse.of(load(id));
    }

    public List<SummaryResponse> listBySource(String sourceKey) {
        return store.findBySource(sourceKey).stream().map(SummaryResponse::of).toList();
    }

    /**
     * Idempotent: cancelling a finished job returns its current state unchanged.
     */
    public ProgressResponse cancel(UUID id) {
        JobStatus status = store.requestCancel(id);
        LOGGER.info("SUMMARY CANCEL jobId={} status={}", id, status);
        return progress(id);
    }

    /**
     * Cancels and removes a job together with its artifact. Deleting a job that does not exist is not an error.
     */
    public void delete(UUID id) {
        Optional<SummaryJob> removed = store.delete(id);
        if (removed.isEmpty()) {
            LOGGER.debug("SUMMARY DELETE jobId={} already absent", id);
            return;
        }
        String key = removed.get().getArtifactKey();
        if (key != null) {
            storage.deleteOut(key);
        }
        LOGGER.info("SUMMARY DELETE jobId={} status={} artifact={}", id, removed.get().getStatus(), key);
    }

    /**
     * Artifact of a completed job.
     *
     * @throws JobConflictException when the job has not completed or its artifact is gone.
     */
    public Artifact artifact(UUID id) {
        SummaryJob job = load(id);
        if (job.getStatus() != JobStatus.COMPLETED || job.getArtifactKey() == null) {
            throw new JobConflictException("Summary " + id + " is not ready (status " + job.getStatus() + ")");
        }
        if (!storage.existsInOut(job.getArtifactKey())) {
            throw new JobConflictException("Artifact of summary " + id + " is missing");
        }
        Path file = storage.resolveOut(job.getArtifactKey());
        String fileName = sanitize(job.getTitle()) + "." + job.getOutputFormat();
        return new Artifact(file, fileName, storage.sizeOut(job.getArtifactKey()));
    }

    private SummaryJob load(UUID id) {
        return store.find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    private static String sanitize(String title) {
        String s = title == null ? "" : title.replaceAll("[^A-Za-z0-9._-]+", "_");
        return s.isBlank() ? "summary" : s;
    }

    /**
     * @param file     local file to stream.
     * @param fileName suggested download name.
     * @param size     size in bytes.
     */
    public record Artifact(Path file, String fileName, long size) {
    }
}
