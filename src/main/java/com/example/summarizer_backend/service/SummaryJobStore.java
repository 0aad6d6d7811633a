package com.example.summarizer_backend.service;

import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.selection.SelectionRequest;
import com.example.summarizer_backend.exception.JobNotFoundException;
import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.repository.SummaryJobRepository;
import com.example.summarizer_backend.util.ErrorKind;
import com.example.summarizer_backend.util.JobStatus;
import com.example.summarizer_backend.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job-status store. Every write runs in its own transaction against a row locked with
 * {@code PESSIMISTIC_WRITE}, so readers only ever see whole committed snapshots. Terminal rows are never
 * changed again; writes that find the row terminal or gone return {@code false} instead of throwing.
 */
@Service
public class SummaryJobStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryJobStore.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final SummaryJobRepository repo;

    public SummaryJobStore(SummaryJobRepository repo) {
        this.repo = repo;
    }

    @Transactional
    public SummaryJob create(String title, String sourceKey, SelectionRequest request, String outputFormat) {
        SummaryJob job = new SummaryJob(title, sourceKey, request.mode(), request.toPayload(), outputFormat);
        job.setStatus(JobStatus.QUEUED);
        job.setProgressPercent(0);
        return repo.save(job);
    }

    @Transactional(readOnly = true)
    public Optional<SummaryJob> find(UUID id) {
        return repo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<SummaryJob> findBySource(String sourceKey) {
        return repo.findBySourceKeyOrderByCreatedAtDesc(sourceKey);
    }

    /**
     * Moves up to {@code max} of the oldest queued jobs to processing and returns their ids.
     */
    @Transactional
    public List<UUID> claimQueued(int max) {
        if (max <= 0) return List.of();
        List<UUID> candidates = repo.findIdsByStatusOldestFirst(JobStatus.QUEUED, PageRequest.of(0, max));
        List<UUID> claimed = new ArrayList<>(candidates.size());
        for (UUID id : candidates) {
            if (claimLocked(id)) claimed.add(id);
        }
        return claimed;
    }

    /** {@code queued -> processing}; the only way into execution. */
    @Transactional
    public boolean claim(UUID id) {
        return claimLocked(id);
    }

    private boolean claimLocked(UUID id) {
        SummaryJob job = repo.findForUpdateById(id).orElse(null);
        if (job == null || job.isCancelRequested() || !moveTo(job, JobStatus.PROCESSING)) {
            return false;
        }
        job.setStartedAt(Instant.now());
        job.setProgressPercent(0);
        return true;
    }

    /**
     * Records a finished stage. Progress never goes down.
     *
     * @return {@code false} when the job is no longer processing or a cancel was requested.
     */
    @Transactional
    public boolean advance(UUID id, PipelineStage stage) {
        SummaryJob job = repo.findForUpdateById(id).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PROCESSING) {
            return false;
        }
        job.setStage(stage);
        job.setProgressPercent(Math.max(job.getProgressPercent(), stage.progressPercent()));
        return !job.isCancelRequested();
    }

    /**
     * Whether the owning worker should stop: the row is gone, left processing, or has a pending cancel.
     */
    @Transactional(readOnly = true)
    public boolean shouldStop(UUID id) {
        return repo.findById(id)
                .map(j -> j.isCancelRequested() || j.getStatus() != JobStatus.PROCESSING)
                .orElse(true);
    }

    @Transactional
    public boolean complete(UUID id, List<SceneCandidate> scenes, String artifactKey, long artifactSize, String outputFormat) {
        SummaryJob job = repo.findForUpdateById(id).orElse(null);
        if (job == null || job.isCancelRequested() || !moveTo(job, JobStatus.COMPLETED)) {
            return false;
        }
        job.setSelectedScenes(toSceneMaps(scenes));
        job.setSummaryDurationMs(scenes.stream().mapToLong(SceneCandidate::durationMs).sum());
        job.setArtifactKey(artifactKey);
        job.setArtifactSize(artifactSize);
        job.setOutputFormat(outputFormat);
        job.setProgressPercent(100);
        job.setCompletedAt(Instant.now());
        return true;
    }

    @Transactional
    public boolean fail(UUID id, ErrorKind kind, String message) {
        SummaryJob job = repo.findForUpdateById(id).orElse(null);
        if (job == null || !moveTo(job, JobStatus.FAILED)) {
            return false;
        }
        job.setErrorKind(kind);
        job.setErrorMessage(truncate(message));
        job.setCompletedAt(Instant.now());
        return true;
    }

    /**
     * Final step of a cooperative cancel, called by the worker once its scratch files are gone.
     */
    @Transactional
    public boolean markCancelled(UUID id) {
        SummaryJob job = repo.findForUpdateById(id).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PROCESSING || !moveTo(job, JobStatus.CANCELLED)) {
            return false;
        }
        job.setCompletedAt(Instant.now());
        return true;
    }

    /**
     * Requests cancellation. A queued job is cancelled on the spot; a processing job only gets the flag
     * and is finished by its worker at the next stage boundary. Terminal jobs are left alone.
     *
     * @return the status after the call.
     */
    @Transactional
    public JobStatus requestCancel(UUID id) {
        SummaryJob job = repo.findForUpdateById(id).orElseThrow(() -> new JobNotFoundException(id));
        if (job.getStatus().isTerminal()) {
            return job.getStatus();
        }
        job.setCancelRequested(true);
        if (job.getStatus() == JobStatus.QUEUED && moveTo(job, JobStatus.CANCELLED)) {
            job.setCompletedAt(Instant.now());
        }
        return job.getStatus();
    }

    /**
     * Removes the row. A processing job is flagged first so its worker stops and discards its output.
     *
     * @return the removed job, empty when there was none.
     */
    @Transactional
    public Optional<SummaryJob> delete(UUID id) {
        Optional<SummaryJob> job = repo.findForUpdateById(id);
        job.ifPresent(j -> {
            j.setCancelRequested(true);
            repo.delete(j);
        });
        return job;
    }

    /**
     * Fails jobs a previous process left in processing.
     */
    @Transactional
    public int failOrphans() {
        List<SummaryJob> orphans = repo.findByStatus(JobStatus.PROCESSING);
        Instant now = Instant.now();
        for (SummaryJob j : orphans) {
            if (j.isCancelRequested()) {
                moveTo(j, JobStatus.CANCELLED);
            } else {
                moveTo(j, JobStatus.FAILED);
                j.setErrorKind(ErrorKind.INTERNAL);
                j.setErrorMessage("worker restarted");
            }
            j.setCompletedAt(now);
            LOGGER.warn("ORPHAN jobId={} -> {}", j.getId(), j.getStatus());
        }
        return orphans.size();
    }

    private static boolean moveTo(SummaryJob job, JobStatus next) {
        if (!job.getStatus().canTransitionTo(next)) {
            LOGGER.debug("STATUS refused jobId={} {} -> {}", job.getId(), job.getStatus(), next);
            return false;
        }
        job.setStatus(next);
        return true;
    }

    static List<Map<String, Object>> toSceneMaps(List<SceneCandidate> scenes) {
        List<Map<String, Object>> out = new ArrayList<>(scenes.size());
        for (SceneCandidate s : scenes) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("startMs", s.startMs());
            m.put("endMs", s.endMs());
            m.put("confidence", s.confidence());
            if (s.matchedLabel() != null) m.put("matchedLabel", s.matchedLabel());
            out.add(m);
        }
        return out;
    }

    public static List<SceneCandidate> scenesOf(SummaryJob job) {
        List<Map<String, Object>> raw = job.getSelectedScenes();
        if (raw == null) return List.of();
        List<SceneCandidate> out = new ArrayList<>(raw.size());
        for (Map<String, Object> m : raw) {
            Object label = m.get("matchedLabel");
            out.add(new SceneCandidate(
                    ((Number) m.get("startMs")).longValue(),
                    ((Number) m.get("endMs")).longValue(),
                    ((Number) m.get("confidence")).doubleValue(),
                    label == null ? null : label.toString()));
        }
        return out;
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
