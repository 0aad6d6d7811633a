package com.example.summarizer_backend.config;

import com.example.summarizer_backend.aggregate.AggregatorConfig;
import com.example.summarizer_backend.aggregate.SceneAggregator;
import com.example.summarizer_backend.embedding.EmbeddingEngine;
import com.example.summarizer_backend.engine.Interfaces.EmbeddingModel;
import com.example.summarizer_backend.engine.Interfaces.FrameDecoder;
import com.example.summarizer_backend.sampler.FrameSampler;
import com.example.summarizer_backend.selector.BudgetedSceneSelector;
import com.example.summarizer_backend.selector.SceneSelector;
import com.example.summarizer_backend.selector.SelectorConfig;
import com.example.summarizer_backend.selector.TimeRangeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline stages, built from {@link PipelineProperties}. All of them are stateless and shared by every job.
 */
@Configuration
public class PipelineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public FrameSampler frameSampler(FrameDecoder decoder, PipelineProperties props) {
        return new FrameSampler(decoder, props.getSampling());
    }

    @Bean
    public EmbeddingEngine embeddingEngine(EmbeddingModel model, EmbeddingProperties props) {
        return new EmbeddingEngine(model, props.getBatchSize());
    }

    @Bean
    public SceneAggregator sceneAggregator(PipelineProperties props) {
        PipelineProperties.Matching m = props.getMatching();
        return new SceneAggregator(new AggregatorConfig(
                m.getThreshold(),
                Math.round(m.getMinSceneSeconds() * 1000.0),
                Math.round(m.getMergeGapSeconds() * 1000.0)));
    }

    @Bean
    public SelectorConfig selectorConfig(PipelineProperties props) {
        PipelineProperties.Selection s = props.getSelection();
        SelectorConfig cfg = new SelectorConfig(
                s.getTargetDurationSeconds() * 1000L,
                props.getMatching().getThreshold(),
                s.getOverflowPolicy(),
                Math.round(s.getMinTrimSeconds() * 1000.0));
        LOGGER.info("Selector wired: budgetMs={} threshold={} policy={}",
                cfg.targetDurationMs(), cfg.threshold(), cfg.overflowPolicy());
        return cfg;
    }

    @Bean
    public SceneSelector sceneSelector() {
        return new BudgetedSceneSelector();
    }

    @Bean
    public TimeRangeMapper timeRangeMapper() {
        return new TimeRangeMapper();
    }
}
