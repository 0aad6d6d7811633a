package com.example.summarizer_backend.sampler;

import com.example.summarizer_backend.config.PipelineProperties;
import com.example.summarizer_backend.dto.SourceVideo;
import com.example.summarizer_backend.engine.Interfaces.FrameDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a probed source into a {@link FrameSequence}. Knows nothing about how frames are used.
 */
public class FrameSampler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameSampler.class);

    private final FrameDecoder decoder;
    private final PipelineProperties.Sampling cfg;

    public FrameSampler(FrameDecoder decoder, PipelineProperties.Sampling cfg) {
        this.decoder = decoder;
        this.cfg = cfg;
    }

    public FrameSequence sample(SourceVideo video) {
        return sample(video, strideFor(video));
    }

    public FrameSequence sample(SourceVideo video, SamplingStride stride) {
        FrameSequence seq = new FrameSequence(decoder, video.file(), video.durationMs(), stride, cfg.getFrameWidth());
        LOGGER.info("SAMPLE file={} strideMs={} expectedFrames={}", video.file().getFileName(), stride.strideMs(), seq.expectedCount());
        return seq;
    }

    /**
     * Configured stride for this source: the fixed time delta when set, otherwise the frame count at the
     * source frame rate, widened to respect the frame cap.
     */
    public SamplingStride strideFor(SourceVideo video) {
        SamplingStride base = cfg.getStrideSeconds() > 0
                ? SamplingStride.ofSeconds(cfg.getStrideSeconds())
                : SamplingStride.ofFrames(Math.max(1, cfg.getStrideFrames()), video.frameRate());
        SamplingStride capped = base.capped(video.durationMs(), cfg.getMaxFrames());
        if (capped.strideMs() != base.strideMs()) {
            LOGGER.info("SAMPLE stride widened from {}ms to {}ms to stay under maxFrames={}",
                    base.strideMs(), capped.strideMs(), cfg.getMaxFrames());
        }
        return capped;
    }
}
