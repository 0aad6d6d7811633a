package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.aggregate.SceneAggregator;
import com.example.summarizer_backend.dto.FrameSample;
import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.ScoredFrame;
import com.example.summarizer_backend.dto.selection.SelectionRequest;
import com.example.summarizer_backend.embedding.EmbeddingEngine;
import com.example.summarizer_backend.exception.ResourceException;
import com.example.summarizer_backend.sampler.FrameSampler;
import com.example.summarizer_backend.sampler.FrameSequence;
import com.example.summarizer_backend.selector.SceneSelector;
import com.example.summarizer_backend.selector.SelectorConfig;
import com.example.summarizer_backend.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Shared flow of the semantic modes: sample, embed, score against a query vector, aggregate into scenes,
 * then pick under the duration budget. Subclasses only say how the query is built.
 */
public abstract class EmbeddingSelectionStrategy implements SceneSelectionStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingSelectionStrategy.class);

    protected final EmbeddingEngine embeddingEngine;
    private final FrameSampler sampler;
    private final SceneAggregator aggregator;
    private final SceneSelector selector;
    private final SelectorConfig selectorConfig;

    protected EmbeddingSelectionStrategy(FrameSampler sampler,
                                         EmbeddingEngine embeddingEngine,
                                         SceneAggregator aggregator,
                                         SceneSelector selector,
                                         SelectorConfig selectorConfig) {
        this.sampler = sampler;
        this.embeddingEngine = embeddingEngine;
        this.aggregator = aggregator;
        this.selector = selector;
        this.selectorConfig = selectorConfig;
    }

    protected abstract float[] queryVector(SelectionRequest request);

    protected abstract String label(SelectionRequest request);

    @Override
    public List<SceneCandidate> select(SelectionContext ctx) {
        JobCheckpoint checkpoint = ctx.checkpoint();
        float[] query = queryVector(ctx.request());

        FrameSequence frames = sampler.sample(ctx.source());
        List<FrameSample> samples = embeddingEngine.embedFrames(frames, checkpoint::throwIfCancelled);
        if (samples.isEmpty()) {
            throw new ResourceException("No frames could be sampled from " + ctx.source().file().getFileName());
        }
        checkpoint.reached(PipelineStage.EMBED_FRAMES);

        List<ScoredFrame> scores = embeddingEngine.score(samples, query);
        checkpoint.reached(PipelineStage.SCORE);

        List<SceneCandidate> candidates = aggregator.aggregate(
                scores, frames.stride().strideMs(), ctx.source().durationMs(), label(ctx.request()));
        checkpoint.reached(PipelineStage.AGGREGATE);

        List<SceneCandidate> selected = selector.select(candidates, selectorConfig);
        LOGGER.info("SELECT jobId={} mode={} frames={} candidates={} selected={}",
                ctx.jobId(), mode(), samples.size(), candidates.size(), selected.size());
        checkpoint.reached(PipelineStage.SELECT);
        return selected;
    }
}
