package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.aggregate.AggregatorConfig;
import com.example.summarizer_backend.aggregate.SceneAggregator;
import com.example.summarizer_backend.catalog.SummaryCategory;
import com.example.summarizer_backend.config.PipelineProperties;
import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.SourceVideo;
import com.example.summarizer_backend.dto.selection.CategoryRequest;
import com.example.summarizer_backend.dto.selection.PercentRange;
import com.example.summarizer_backend.dto.selection.TextPromptRequest;
import com.example.summarizer_backend.dto.selection.TimeRangesRequest;
import com.example.summarizer_backend.embedding.EmbeddingEngine;
import com.example.summarizer_backend.engine.FakeEmbeddingModel;
import com.example.summarizer_backend.engine.Interfaces.FrameDecoder;
import com.example.summarizer_backend.exception.JobCancelledException;
import com.example.summarizer_backend.exception.NoMatchException;
import com.example.summarizer_backend.sampler.FrameSampler;
import com.example.summarizer_backend.selector.BudgetedSceneSelector;
import com.example.summarizer_backend.selector.OverflowPolicy;
import com.example.summarizer_backend.selector.SelectorConfig;
import com.example.summarizer_backend.selector.TimeRangeMapper;
import com.example.summarizer_backend.util.PipelineStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectionStrategyTest {

    private static final SourceVideo SOURCE =
            new SourceVideo(Path.of("holiday.mp4"), 60_000, 30.0, 640, 360, "mov,mp4", "h264", "aac", 0L);

    /** One 10s interval at 0.9 from 10s, one 5s interval at 0.4 from 40s, background at 0.1. */
    private static final FrameDecoder SUNSET_VIDEO = (file, ts, width) -> {
        double score = 0.1;
        if (ts >= 10_000 && ts < 20_000) score = 0.9;
        if (ts >= 40_000 && ts < 45_000) score = 0.4;
        return FakeEmbeddingModel.imageScoring(score);
    };

    private FakeEmbeddingModel model;
    private RecordingCheckpoint checkpoint;

    @BeforeEach
    void setUp() {
        model = new FakeEmbeddingModel();
        checkpoint = new RecordingCheckpoint();
    }

    private FrameSampler sampler() {
        PipelineProperties.Sampling cfg = new PipelineProperties.Sampling();
        cfg.setStrideSeconds(1.0);
        return new FrameSampler(SUNSET_VIDEO, cfg);
    }

    private TextPromptSelectionStrategy textStrategy() {
        return new TextPromptSelectionStrategy(
                sampler(),
                new EmbeddingEngine(model, 8),
                new SceneAggregator(new AggregatorConfig(0.3, 1_000, 2_000)),
                new BudgetedSceneSelector(),
                new SelectorConfig(60_000, 0.5, OverflowPolicy.ADMIT_THEN_STOP, 1_000));
    }

    @Test
    void sunsetPromptSelectsOnlyTheConfidentInterval() {
        List<SceneCandidate> scenes = textStrategy().select(
                new SelectionContext(UUID.randomUUID(), SOURCE, new TextPromptRequest("sunset"), checkpoint));

        assertThat(scenes).hasSize(1);
        assertThat(scenes.get(0).startMs()).isEqualTo(10_000);
        assertThat(scenes.get(0).endMs()).isEqualTo(20_000);
        assertThat(scenes.get(0).matchedLabel()).isEqualTo("sunset");
        assertThat(checkpoint.stages).containsExactly(
                PipelineStage.EMBED_FRAMES, PipelineStage.SCORE, PipelineStage.AGGREGATE, PipelineStage.SELECT);
    }

    @Test
    void categoryUsesTemplateEnsembleAndCategoryLabel() {
        CategorySelectionStrategy strategy = new CategorySelectionStrategy(
                sampler(),
                new EmbeddingEngine(model, 8),
                new SceneAggregator(new AggregatorConfig(0.5, 1_000, 2_000)),
                new BudgetedSceneSelector(),
                SelectorConfig.defaults());

        List<SceneCandidate> scenes = strategy.select(new SelectionContext(
                UUID.randomUUID(), SOURCE, new CategoryRequest(SummaryCategory.LANDSCAPE), checkpoint));

        assertThat(scenes).extracting(SceneCandidate::matchedLabel).containsOnly("landscape");
        assertThat(model.textCalls.get()).isEqualTo(1);
    }

    @Test
    void noMatchWhenNothingClearsThreshold() {
        TextPromptSelectionStrategy strategy = new TextPromptSelectionStrategy(
                sampler(),
                new EmbeddingEngine(model, 8),
                new SceneAggregator(new AggregatorConfig(0.95, 1_000, 2_000)),
                new BudgetedSceneSelector(),
                SelectorConfig.defaults());

        assertThatThrownBy(() -> strategy.select(
                new SelectionContext(UUID.randomUUID(), SOURCE, new TextPromptRequest("snow"), checkpoint)))
                .isInstanceOf(NoMatchException.class);
    }

    @Test
    void cancellationBetweenBatchesStopsEmbedding() {
        UUID jobId = UUID.randomUUID();
        RecordingCheckpoint cancelling = new RecordingCheckpoint() {
            int checks;

            @Override
            public void throwIfCancelled() {
                if (++checks == 3) throw new JobCancelledException(jobId);
            }
        };

        assertThatThrownBy(() -> textStrategy().select(
                new SelectionContext(jobId, SOURCE, new TextPromptRequest("sunset"), cancelling)))
                .isInstanceOf(JobCancelledException.class);
        assertThat(model.imageCalls.get()).isEqualTo(2);
        assertThat(cancelling.stages).isEmpty();
    }

    @Test
    void timeRangesNeverTouchEmbeddings() {
        TimeRangeSelectionStrategy strategy = new TimeRangeSelectionStrategy(new TimeRangeMapper());
        SourceVideo hundredSeconds =
                new SourceVideo(Path.of("talk.mp4"), 100_000, 25.0, 640, 360, "mov,mp4", "h264", "aac", 0L);

        List<SceneCandidate> scenes = strategy.select(new SelectionContext(UUID.randomUUID(), hundredSeconds,
                new TimeRangesRequest(List.of(new PercentRange(0, 25), new PercentRange(50, 75))), checkpoint));

        assertThat(scenes).extracting(SceneCandidate::startMs).containsExactly(0L, 50_000L);
        assertThat(scenes).extracting(SceneCandidate::endMs).containsExactly(25_000L, 75_000L);
        assertThat(model.totalCalls()).isZero();
        assertThat(checkpoint.stages).containsExactly(PipelineStage.SELECT);
    }

    static class RecordingCheckpoint implements JobCheckpoint {
        final List<PipelineStage> stages = new ArrayList<>();

        @Override
        public void throwIfCancelled() {
        }

        @Override
        public void reached(PipelineStage stage) {
            stages.add(stage);
        }
    }
}
