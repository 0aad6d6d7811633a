package com.example.summarizer_backend.service;

import com.example.summarizer_backend.catalog.CategoryCatalog;
import com.example.summarizer_backend.config.ComposeProperties;
import com.example.summarizer_backend.dto.selection.TextPromptRequest;
import com.example.summarizer_backend.dto.web.ProgressResponse;
import com.example.summarizer_backend.dto.web.SummaryCreateRequest;
import com.example.summarizer_backend.exception.JobConflictException;
import com.example.summarizer_backend.exception.JobNotFoundException;
import com.example.summarizer_backend.exception.ValidationException;
import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.service.Interfaces.StorageService;
import com.example.summarizer_backend.util.JobStatus;
import com.example.summarizer_backend.util.SelectionMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SummaryJobServiceTest {

    @Mock
    SummaryJobStore store;
    @Mock
    StorageService storage;
    @Mock
    WorkerService worker;

    private final ObjectMapper om = new ObjectMapper();
    private SummaryJobService service;

    @BeforeEach
    void setUp() {
        ComposeProperties compose = new ComposeProperties();
        SelectionRequestParser parser = new SelectionRequestParser(new CategoryCatalog(), om, compose);
        service = new SummaryJobService(store, parser, storage, worker, compose);
    }

    private static SummaryJob job(UUID id, JobStatus status) {
        SummaryJob job = new SummaryJob("My holiday!", "raw/holiday.mp4", SelectionMode.TEXT_PROMPT,
                Map.of("prompt", "sunset"), "mp4");
        job.setId(id);
        job.setStatus(status);
        return job;
    }

    @Test
    void createValidatesThenQueues() {
        UUID id = UUID.randomUUID();
        when(store.create(eq("holiday"), eq("raw/holiday.mp4"), eq(new TextPromptRequest("sunset")), eq("mp4")))
                .thenReturn(job(id, JobStatus.QUEUED));

        ProgressResponse res = service.create(new SummaryCreateRequest(" holiday ", "raw/holiday.mp4", "text-prompt",
                om.createObjectNode().put("prompt", "sunset")));

        assertThat(res.id()).isEqualTo(id);
        assertThat(res.status()).isEqualTo("QUEUED");
    }

    @Test
    void createStartsJobRightAwayWhenAWorkerIsIdle() {
        UUID id = UUID.randomUUID();
        when(store.create(anyString(), anyString(), any(), anyString())).thenReturn(job(id, JobStatus.QUEUED));
        when(worker.hasIdleSlot()).thenReturn(true);

        service.create(new SummaryCreateRequest("holiday", "raw/holiday.mp4", "text-prompt",
                om.createObjectNode().put("prompt", "sunset")));

        verify(worker).dispatch(id);
    }

    @Test
    void createLeavesJobToPollerWhenWorkersAreBusy() {
        UUID id = UUID.randomUUID();
        when(store.create(anyString(), anyString(), any(), anyString())).thenReturn(job(id, JobStatus.QUEUED));
        when(worker.hasIdleSlot()).thenReturn(false);

        ProgressResponse res = service.create(new SummaryCreateRequest("holiday", "raw/holiday.mp4", "text-prompt",
                om.createObjectNode().put("prompt", "sunset")));

        assertThat(res.status()).isEqualTo("QUEUED");
        verify(worker, never()).dispatch(any());
    }

    @Test
    void createToleratesJobAlreadyClaimedByPoller() {
        UUID id = UUID.randomUUID();
        when(store.create(anyString(), anyString(), any(), anyString())).thenReturn(job(id, JobStatus.QUEUED));
        when(worker.hasIdleSlot()).thenReturn(true);
        doThrow(new JobConflictException("Summary " + id + " is not queued")).when(worker).dispatch(id);

        ProgressResponse res = service.create(new SummaryCreateRequest("holiday", "raw/holiday.mp4", "text-prompt",
                om.createObjectNode().put("prompt", "sunset")));

        assertThat(res.id()).isEqualTo(id);
    }

    @Test
    void invalidRequestCreatesNoJob() {
        assertThatThrownBy(() -> service.create(new SummaryCreateRequest("holiday", "raw/holiday.mp4", "category",
                om.createObjectNode().put("category_id", "nope"))))
                .isInstanceOf(ValidationException.class);

        verify(store, never()).create(anyString(), anyString(), any(), anyString());
    }

    @Test
    void unknownJobIsNotFound() {
        UUID id = UUID.randomUUID();
        when(store.find(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.progress(id)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void deleteRemovesArtifactAndIsIdempotent() {
        UUID id = UUID.randomUUID();
        SummaryJob done = job(id, JobStatus.COMPLETED);
        done.setArtifactKey("summaries/" + id + ".mp4");
        when(store.delete(id)).thenReturn(Optional.of(done)).thenReturn(Optional.empty());

        service.delete(id);
        service.delete(id);

        verify(storage).deleteOut("summaries/" + id + ".mp4");
    }

    @Test
    void deletingCancelledJobTwiceDoesNotError() {
        UUID id = UUID.randomUUID();
        when(store.delete(id)).thenReturn(Optional.of(job(id, JobStatus.CANCELLED))).thenReturn(Optional.empty());

        service.delete(id);
        service.delete(id);

        verify(storage, never()).deleteOut(anyString());
    }

    @Test
    void cancelReturnsCurrentProgress() {
        UUID id = UUID.randomUUID();
        when(store.requestCancel(id)).thenReturn(JobStatus.CANCELLED);
        when(store.find(id)).thenReturn(Optional.of(job(id, JobStatus.CANCELLED)));

        assertThat(service.cancel(id).status()).isEqualTo("CANCELLED");
    }

    @Test
    void artifactRequiresCompletedJob() {
        UUID id = UUID.randomUUID();
        when(store.find(id)).thenReturn(Optional.of(job(id, JobStatus.PROCESSING)));

        assertThatThrownBy(() -> service.artifact(id)).isInstanceOf(JobConflictException.class);
    }

    @Test
    void artifactUsesSanitizedTitle() {
        UUID id = UUID.randomUUID();
        SummaryJob done = job(id, JobStatus.COMPLETED);
        String key = "summaries/" + id + ".mp4";
        done.setArtifactKey(key);
        when(store.find(id)).thenReturn(Optional.of(done));
        when(storage.existsInOut(key)).thenReturn(true);
        when(storage.resolveOut(key)).thenReturn(Path.of("/data/out", key));
        when(storage.sizeOut(key)).thenReturn(42L);

        SummaryJobService.Artifact artifact = service.artifact(id);

        assertThat(artifact.fileName()).isEqualTo("My_holiday_.mp4");
        assertThat(artifact.size()).isEqualTo(42L);
    }

    @Test
    void resultIsStableAcrossReads() {
        UUID id = UUID.randomUUID();
        when(store.find(id)).thenReturn(Optional.of(job(id, JobStatus.COMPLETED)));

        assertThat(service.result(id)).isEqualTo(service.result(id));
    }
}
