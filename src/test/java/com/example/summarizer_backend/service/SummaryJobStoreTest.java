package com.example.summarizer_backend.service;

import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.selection.PercentRange;
import com.example.summarizer_backend.dto.selection.TextPromptRequest;
import com.example.summarizer_backend.dto.selection.TimeRangesRequest;
import com.example.summarizer_backend.exception.JobNotFoundException;
import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.repository.SummaryJobRepository;
import com.example.summarizer_backend.util.ErrorKind;
import com.example.summarizer_backend.util.JobStatus;
import com.example.summarizer_backend.util.PipelineStage;
import com.example.summarizer_backend.util.SelectionMode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(SummaryJobStore.class)
class SummaryJobStoreTest {

    @Autowired
    private SummaryJobStore store;

    @Autowired
    private SummaryJobRepository repository;

    private SummaryJob newJob() {
        return store.create("holiday", "raw/holiday.mp4", new TextPromptRequest("sunset"), "mp4");
    }

    private SummaryJob reload(UUID id) {
        return store.find(id).orElseThrow();
    }

    @Test
    void createdJobIsQueuedWithStoredPayload() {
        SummaryJob job = newJob();

        SummaryJob stored = reload(job.getId());
        assertThat(stored.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(stored.getProgressPercent()).isZero();
        assertThat(stored.getMode()).isEqualTo(SelectionMode.TEXT_PROMPT);
        assertThat(stored.getRequestData()).containsEntry("prompt", "sunset");
        assertThat(repository.findByStatus(JobStatus.QUEUED)).extracting(SummaryJob::getId).containsExactly(job.getId());
    }

    @Test
    void queuedJobCannotSkipProcessing() {
        SummaryJob job = newJob();

        assertThat(store.complete(job.getId(), List.of(new SceneCandidate(0, 1_000, 1.0, null)), "k", 1L, "mp4")).isFalse();
        assertThat(store.fail(job.getId(), ErrorKind.INTERNAL, "too early")).isFalse();
        assertThat(store.markCancelled(job.getId())).isFalse();
        assertThat(reload(job.getId()).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void claimMovesQueuedToProcessingOnce() {
        SummaryJob job = newJob();

        assertThat(store.claim(job.getId())).isTrue();
        assertThat(store.claim(job.getId())).isFalse();
        assertThat(reload(job.getId()).getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(reload(job.getId()).getStartedAt()).isNotNull();
    }

    @Test
    void claimQueuedHonoursLimit() {
        newJob();
        newJob();
        newJob();

        assertThat(store.claimQueued(2)).hasSize(2);
        assertThat(store.claimQueued(5)).hasSize(1);
        assertThat(store.claimQueued(5)).isEmpty();
        assertThat(store.claimQueued(0)).isEmpty();
    }

    @Test
    void progressIsMonotonic() {
        SummaryJob job = newJob();
        store.claim(job.getId());

        assertThat(store.advance(job.getId(), PipelineStage.SCORE)).isTrue();
        assertThat(store.advance(job.getId(), PipelineStage.PROBE)).isTrue();

        assertThat(reload(job.getId()).getProgressPercent()).isEqualTo(PipelineStage.SCORE.progressPercent());
    }

    @Test
    void advanceRefusesQueuedJobs() {
        SummaryJob job = newJob();

        assertThat(store.advance(job.getId(), PipelineStage.PROBE)).isFalse();
        assertThat(store.shouldStop(job.getId())).isTrue();
    }

    @Test
    void completeStoresScenesAndTotals() {
        SummaryJob job = newJob();
        store.claim(job.getId());
        List<SceneCandidate> scenes = List.of(
                new SceneCandidate(0, 10_000, 0.9, "sunset"),
                new SceneCandidate(20_000, 25_000, 0.7, null));

        assertThat(store.complete(job.getId(), scenes, "summaries/x.mp4", 1234L, "mp4")).isTrue();

        SummaryJob done = reload(job.getId());
        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.getProgressPercent()).isEqualTo(100);
        assertThat(done.getSummaryDurationMs()).isEqualTo(15_000L);
        assertThat(SummaryJobStore.scenesOf(done)).isEqualTo(scenes);
        assertThat(store.fail(job.getId(), ErrorKind.INTERNAL, "late")).isFalse();
        assertThat(reload(job.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void failTruncatesLongMessagesAndFreezesProgress() {
        SummaryJob job = newJob();
        store.claim(job.getId());
        store.advance(job.getId(), PipelineStage.PROBE);

        assertThat(store.fail(job.getId(), ErrorKind.RESOURCE, "x".repeat(5000))).isTrue();

        SummaryJob failed = reload(job.getId());
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getErrorKind()).isEqualTo(ErrorKind.RESOURCE);
        assertThat(failed.getErrorMessage()).hasSize(2000);
        assertThat(failed.getProgressPercent()).isEqualTo(PipelineStage.PROBE.progressPercent());
    }

    @Test
    void cancellingQueuedJobIsImmediate() {
        SummaryJob job = newJob();

        assertThat(store.requestCancel(job.getId())).isEqualTo(JobStatus.CANCELLED);
        assertThat(store.claim(job.getId())).isFalse();
    }

    @Test
    void cancellingProcessingJobOnlyFlagsIt() {
        SummaryJob job = newJob();
        store.claim(job.getId());

        assertThat(store.requestCancel(job.getId())).isEqualTo(JobStatus.PROCESSING);
        assertThat(store.shouldStop(job.getId())).isTrue();
        assertThat(store.advance(job.getId(), PipelineStage.PROBE)).isFalse();
        assertThat(store.complete(job.getId(), List.of(new SceneCandidate(0, 1_000, 1.0, null)), "k", 1L, "mp4")).isFalse();

        assertThat(store.markCancelled(job.getId())).isTrue();
        assertThat(reload(job.getId()).getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void cancellingTerminalJobLeavesIt() {
        SummaryJob job = newJob();
        store.claim(job.getId());
        store.fail(job.getId(), ErrorKind.NO_MATCH, "nothing matched");

        assertThat(store.requestCancel(job.getId())).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void cancellingUnknownJobIsNotFound() {
        assertThatThrownBy(() -> store.requestCancel(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void deleteIsIdempotent() {
        SummaryJob job = newJob();

        assertThat(store.delete(job.getId())).isPresent();
        assertThat(store.delete(job.getId())).isEmpty();
        assertThat(store.find(job.getId())).isEmpty();
    }

    @Test
    void orphansFromPreviousRunAreClosed() {
        SummaryJob running = newJob();
        SummaryJob cancelling = store.create("talk", "raw/talk.mp4",
                new TimeRangesRequest(List.of(new PercentRange(0, 50))), "mp4");
        SummaryJob waiting = newJob();
        store.claim(running.getId());
        store.claim(cancelling.getId());
        store.requestCancel(cancelling.getId());

        assertThat(store.failOrphans()).isEqualTo(2);

        assertThat(reload(running.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(reload(running.getId()).getErrorKind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(reload(cancelling.getId()).getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(reload(waiting.getId()).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void findsJobsBySource() {
        newJob();
        store.create("other", "raw/other.mp4", new TextPromptRequest("dogs"), "mp4");

        assertThat(store.findBySource("raw/holiday.mp4")).hasSize(1);
    }
}
