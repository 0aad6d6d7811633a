package com.example.summarizer_backend.service;

import com.example.summarizer_backend.aggregate.AggregatorConfig;
import com.example.summarizer_backend.aggregate.SceneAggregator;
import com.example.summarizer_backend.catalog.CategoryCatalog;
import com.example.summarizer_backend.config.ComposeProperties;
import com.example.summarizer_backend.config.PipelineProperties;
import com.example.summarizer_backend.config.StorageProperties;
import com.example.summarizer_backend.dto.ComposeResult;
import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.SourceVideo;
import com.example.summarizer_backend.dto.selection.PercentRange;
import com.example.summarizer_backend.dto.selection.TextPromptRequest;
import com.example.summarizer_backend.dto.selection.TimeRangesRequest;
import com.example.summarizer_backend.embedding.EmbeddingEngine;
import com.example.summarizer_backend.engine.FakeEmbeddingModel;
import com.example.summarizer_backend.engine.Interfaces.MediaProbe;
import com.example.summarizer_backend.engine.Interfaces.SummaryComposer;
import com.example.summarizer_backend.exception.ComposeException;
import com.example.summarizer_backend.exception.ResourceException;
import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.sampler.FrameSampler;
import com.example.summarizer_backend.selector.BudgetedSceneSelector;
import com.example.summarizer_backend.selector.SelectorConfig;
import com.example.summarizer_backend.selector.TimeRangeMapper;
import com.example.summarizer_backend.service.Interfaces.StorageService;
import com.example.summarizer_backend.service.strategy.TextPromptSelectionStrategy;
import com.example.summarizer_backend.service.strategy.TimeRangeSelectionStrategy;
import com.example.summarizer_backend.util.ErrorKind;
import com.example.summarizer_backend.util.JobStatus;
import com.example.summarizer_backend.util.PipelineStage;
import com.example.summarizer_backend.util.SelectionMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SummaryPipelineTest {

    @TempDir
    Path tmp;

    @Mock
    SummaryJobStore store;
    @Mock
    StorageService storage;
    @Mock
    MediaProbe probe;
    @Mock
    SummaryComposer composer;

    private Path workRoot;
    private Path sourceFile;
    private FakeEmbeddingModel model;
    private SummaryPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        workRoot = tmp.resolve("work");
        sourceFile = Files.writeString(tmp.resolve("holiday.mp4"), "video");
        model = new FakeEmbeddingModel();

        ComposeProperties compose = new ComposeProperties();
        compose.setWorkDir(workRoot.toString());
        SelectionRequestParser parser = new SelectionRequestParser(new CategoryCatalog(), new ObjectMapper(), compose);

        PipelineProperties.Sampling sampling = new PipelineProperties.Sampling();
        sampling.setStrideSeconds(1.0);
        TextPromptSelectionStrategy text = new TextPromptSelectionStrategy(
                new FrameSampler((f, ts, w) -> FakeEmbeddingModel.imageScoring(0.9), sampling),
                new EmbeddingEngine(model, 8),
                new SceneAggregator(new AggregatorConfig(0.5, 1_000, 2_000)),
                new BudgetedSceneSelector(),
                SelectorConfig.defaults());
        TimeRangeSelectionStrategy ranges = new TimeRangeSelectionStrategy(new TimeRangeMapper());

        pipeline = new SummaryPipeline(store, parser, storage, probe, composer,
                List.of(text, ranges), compose, new StorageProperties());

        when(storage.existsInRaw("raw/holiday.mp4")).thenReturn(true);
        when(storage.resolveRaw("raw/holiday.mp4")).thenReturn(sourceFile);
        when(probe.probe(sourceFile)).thenReturn(
                new SourceVideo(sourceFile, 100_000, 25.0, 640, 360, "mov,mp4", "h264", "aac", 0L));
        when(store.shouldStop(any())).thenReturn(false);
        when(store.advance(any(), any())).thenReturn(true);
        when(store.complete(any(), anyList(), anyString(), anyLong(), anyString())).thenReturn(true);
        when(composer.compose(any(), anyList(), any(), anyString())).thenAnswer(inv -> {
            Path dir = inv.getArgument(2);
            Files.writeString(dir.resolve("part-000.mp4"), "part");
            Path out = Files.writeString(dir.resolve("summary.mp4"), "summary");
            return new ComposeResult(out, Files.size(out), true);
        });
    }

    private UUID queued(SummaryJob job) {
        UUID id = UUID.randomUUID();
        job.setId(id);
        job.setStatus(JobStatus.PROCESSING);
        when(store.find(id)).thenReturn(Optional.of(job));
        return id;
    }

    private UUID timeRangeJob() {
        TimeRangesRequest req = new TimeRangesRequest(List.of(new PercentRange(0, 25), new PercentRange(50, 75)));
        return queued(new SummaryJob("talk", "raw/holiday.mp4", SelectionMode.TIME_RANGE, req.toPayload(), "mp4"));
    }

    private void assertWorkspaceEmpty() throws IOException {
        if (!Files.exists(workRoot)) return;
        try (Stream<Path> files = Files.walk(workRoot)) {
            assertThat(files.filter(Files::isRegularFile)).isEmpty();
        }
    }

    @Test
    void timeRangeJobCompletesWithoutEmbeddings() throws IOException {
        UUID id = timeRangeJob();

        JobStatus status = pipeline.run(id);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(model.totalCalls()).isZero();
        String key = "summaries/" + id + ".mp4";
        verify(storage).uploadToOut(any(Path.class), eq(key));
        verify(store).complete(eq(id), eq(List.of(
                new SceneCandidate(0, 25_000, 1.0, "0.0%-25.0%"),
                new SceneCandidate(50_000, 75_000, 1.0, "50.0%-75.0%"))), eq(key), anyLong(), eq("mp4"));
        verify(store).advance(id, PipelineStage.PROBE);
        verify(store).advance(id, PipelineStage.PUBLISH);
        assertWorkspaceEmpty();
    }

    @Test
    void textPromptJobRunsThroughEmbeddings() {
        UUID id = queued(new SummaryJob("holiday", "raw/holiday.mp4", SelectionMode.TEXT_PROMPT,
                new TextPromptRequest("sunset").toPayload(), "mp4"));

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.COMPLETED);
        assertThat(model.imageCalls.get()).isPositive();
        verify(store).advance(id, PipelineStage.EMBED_FRAMES);
    }

    @Test
    void corruptSourceFailsAsResourceErrorWithProgressFrozen() throws IOException {
        when(probe.probe(sourceFile)).thenThrow(new ResourceException("Source video is not decodable (ffprobe exit 1)"));
        UUID id = timeRangeJob();

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.FAILED);

        verify(store).fail(eq(id), eq(ErrorKind.RESOURCE), contains("not decodable"));
        verify(store, never()).advance(any(), any());
        verify(composer, never()).compose(any(), anyList(), any(), anyString());
        assertWorkspaceEmpty();
    }

    @Test
    void missingSourceIsAResourceError() {
        when(storage.existsInRaw("raw/holiday.mp4")).thenReturn(false);
        UUID id = timeRangeJob();

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.FAILED);
        verify(store).fail(eq(id), eq(ErrorKind.RESOURCE), contains("not found"));
    }

    @Test
    void cancelMidProcessingLeavesNoFilesBehind() throws IOException {
        UUID id = timeRangeJob();
        when(store.advance(id, PipelineStage.COMPOSE)).thenReturn(false);

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.CANCELLED);

        verify(store).markCancelled(id);
        verify(storage, never()).uploadToOut(any(), anyString());
        verify(store, never()).complete(any(), anyList(), anyString(), anyLong(), anyString());
        assertWorkspaceEmpty();
    }

    @Test
    void cancelBeforeStartDoesNoWork() {
        UUID id = timeRangeJob();
        when(store.shouldStop(id)).thenReturn(true);

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.CANCELLED);

        verify(probe, never()).probe(any());
        verify(store).markCancelled(id);
    }

    @Test
    void cancelRaceAtCompletionDiscardsPublishedArtifact() {
        UUID id = timeRangeJob();
        when(store.complete(any(), anyList(), anyString(), anyLong(), anyString())).thenReturn(false);

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.CANCELLED);

        verify(storage).deleteOut("summaries/" + id + ".mp4");
        verify(store).markCancelled(id);
    }

    @Test
    void composeFailureIsRecordedAndWorkspaceCleaned() throws IOException {
        doAnswer(inv -> {
            Path dir = inv.getArgument(2);
            Files.writeString(dir.resolve("part-000.mp4"), "half written");
            throw new ComposeException("ffmpeg concat-encode exited with 1", false);
        }).when(composer).compose(any(), anyList(), any(), anyString());
        UUID id = timeRangeJob();

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.FAILED);

        verify(store).fail(eq(id), eq(ErrorKind.COMPOSE), contains("concat"));
        assertWorkspaceEmpty();
    }

    @Test
    void unexpectedErrorsBecomeInternalFailures() {
        doThrow(new IllegalStateException("boom")).when(composer).compose(any(), anyList(), any(), anyString());
        UUID id = timeRangeJob();

        assertThat(pipeline.run(id)).isEqualTo(JobStatus.FAILED);
        verify(store).fail(eq(id), eq(ErrorKind.INTERNAL), contains("boom"));
    }

    @Test
    void vanishedJobIsSkipped() {
        UUID id = UUID.randomUUID();
        when(store.find(id)).thenReturn(Optional.empty());

        assertThat(pipeline.run(id)).isNull();
        verify(store, never()).fail(any(), any(), anyString());
    }
}
