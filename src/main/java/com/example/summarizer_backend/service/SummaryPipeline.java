package com.example.summarizer_backend.service;

import com.example.summarizer_backend.config.ComposeProperties;
import com.example.summarizer_backend.config.StorageProperties;
import com.example.summarizer_backend.dto.ComposeResult;
import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.SourceVideo;
import com.example.summarizer_backend.dto.selection.SelectionRequest;
import com.example.summarizer_backend.engine.Interfaces.MediaProbe;
import com.example.summarizer_backend.engine.Interfaces.SummaryComposer;
import com.example.summarizer_backend.exception.JobCancelledException;
import com.example.summarizer_backend.exception.ResourceException;
import com.example.summarizer_backend.exception.StorageException;
import com.example.summarizer_backend.exception.SummarizationException;
import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.service.Interfaces.StorageService;
import com.example.summarizer_backend.service.strategy.JobCheckpoint;
import com.example.summarizer_backend.service.strategy.SceneSelectionStrategy;
import com.example.summarizer_backend.service.strategy.SelectionContext;
import com.example.summarizer_backend.util.ErrorKind;
import com.example.summarizer_backend.util.JobStatus;
import com.example.summarizer_backend.util.PipelineStage;
import com.example.summarizer_backend.util.SelectionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one claimed job end to end: probe, select, compose, publish. Progress is written at every stage
 * boundary and cancellation is checked there too. Whatever happens, the job workspace is gone before the
 * job leaves {@code PROCESSING}, and no exception leaves {@link #run(UUID)}.
 */
@Service
public class SummaryPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryPipeline.class);

    private final SummaryJobStore store;
    private final SelectionRequestParser parser;
    private final StorageService storage;
    private final MediaProbe probe;
    private final SummaryComposer composer;
    private final Map<SelectionMode, SceneSelectionStrategy> strategies = new EnumMap<>(SelectionMode.class);
    private final Path workRoot;
    private final String summaryPrefix;

    public SummaryPipeline(SummaryJobStore store,
                           SelectionRequestParser parser,
                           StorageService storage,
                           MediaProbe probe,
                           SummaryComposer composer,
                           List<SceneSelectionStrategy> strategies,
                           ComposeProperties composeProperties,
                           StorageProperties storageProperties) {
        this.store = store;
        this.parser = parser;
        this.storage = storage;
        this.probe = probe;
        this.composer = composer;
        for (SceneSelectionStrategy s : strategies) {
            SceneSelectionStrategy previous = this.strategies.put(s.mode(), s);
            if (previous != null) {
                throw new IllegalStateException("Two strategies for mode " + s.mode());
            }
        }
        this.workRoot = Path.of(composeProperties.getWorkDir());
        this.summaryPrefix = storageProperties.getSummaryPrefix();
    }

    /**
     * @return the terminal status the job ended in, {@code null} if the job vanished before it started.
     */
    public JobStatus run(UUID jobId) {
        SummaryJob job = store.find(jobId).orElse(null);
        if (job == null) {
            LOGGER.warn("JOB SKIP jobId={} reason=not_found", jobId);
            return null;
        }
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} mode={} source={}", jobId, job.getMode().wireName(), job.getSourceKey());

        Checkpoint checkpoint = new Checkpoint(jobId);
        String format = job.getOutputFormat().toLowerCase(Locale.ROOT);
        String artifactKey = null;
        try {
            List<SceneCandidate> scenes;
            long artifactSize;
            try (JobWorkspace ws = JobWorkspace.open(workRoot, jobId)) {
                checkpoint.throwIfCancelled();
                SelectionRequest request = parser.fromStored(job.getMode(), job.getRequestData());

                SourceVideo video = probe.probe(resolveSource(job.getSourceKey()));
                checkpoint.reached(PipelineStage.PROBE);

                scenes = strategyFor(request.mode()).select(new SelectionContext(jobId, video, request, checkpoint));

                ComposeResult composed = composer.compose(video, scenes, ws.dir(), format);
                checkpoint.reached(PipelineStage.COMPOSE);

                artifactKey = artifactKey(jobId, format);
                storage.uploadToOut(composed.file(), artifactKey);
                artifactSize = composed.sizeBytes();
                checkpoint.reached(PipelineStage.PUBLISH);
            }

            if (!store.complete(jobId, scenes, artifactKey, artifactSize, format)) {
                discardArtifact(artifactKey);
                store.markCancelled(jobId);
                LOGGER.info("JOB CANCELLED jobId={} at=complete in={}ms", jobId, elapsedMs(t0));
                return JobStatus.CANCELLED;
            }
            LOGGER.info("JOB DONE jobId={} scenes={} artifact={} bytes={} in={}ms",
                    jobId, scenes.size(), artifactKey, artifactSize, elapsedMs(t0));
            return JobStatus.COMPLETED;
        } catch (JobCancelledException e) {
            discardArtifact(artifactKey);
            store.markCancelled(jobId);
            LOGGER.info("JOB CANCELLED jobId={} in={}ms", jobId, elapsedMs(t0));
            return JobStatus.CANCELLED;
        } catch (SummarizationException e) {
            discardArtifact(artifactKey);
            store.fail(jobId, e.getKind(), e.getMessage());
            LOGGER.warn("JOB FAILED jobId={} kind={} message={} in={}ms", jobId, e.getKind(), e.getMessage(), elapsedMs(t0));
            return JobStatus.FAILED;
        } catch (RuntimeException e) {
            discardArtifact(artifactKey);
            LOGGER.error("JOB FAILED jobId={} kind={} in={}ms: {}", jobId, ErrorKind.INTERNAL, elapsedMs(t0), e.toString(), e);
            store.fail(jobId, ErrorKind.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage());
            return JobStatus.FAILED;
        }
    }

    public String artifactKey(UUID jobId, String format) {
        return summaryPrefix + "/" + jobId + "." + format;
    }

    private SceneSelectionStrategy strategyFor(SelectionMode mode) {
        SceneSelectionStrategy s = strategies.get(mode);
        if (s == null) {
            throw new IllegalStateException("No strategy registered for mode " + mode);
        }
        return s;
    }

    private Path resolveSource(String sourceKey) {
        try {
            if (!storage.existsInRaw(sourceKey)) {
                throw new ResourceException("Source video not found: " + sourceKey);
            }
            return storage.resolveRaw(sourceKey);
        } catch (StorageException e) {
            throw new ResourceException("Source video key is not usable: " + sourceKey, e);
        }
    }

    private void discardArtifact(String artifactKey) {
        if (artifactKey == null) return;
        try {
            storage.deleteOut(artifactKey);
        } catch (StorageException e) {
            LOGGER.error("ARTIFACT cleanup failed key={}: {}", artifactKey, e.toString(), e);
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }

    private final class Checkpoint implements JobCheckpoint {
        private final UUID jobId;

        Checkpoint(UUID jobId) {
            this.jobId = jobId;
        }

        @Override
        public void throwIfCancelled() {
            if (store.shouldStop(jobId)) {
                throw new JobCancelledException(jobId);
            }
        }

        @Override
        public void reached(PipelineStage stage) {
            if (!store.advance(jobId, stage)) {
                throw new JobCancelledException(jobId);
            }
            LOGGER.info("JOB STAGE jobId={} stage={} progress={}", jobId, stage, stage.progressPercent());
        }
    }
}
