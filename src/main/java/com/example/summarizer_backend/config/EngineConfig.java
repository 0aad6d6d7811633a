package com.example.summarizer_backend.config;

import com.example.summarizer_backend.engine.DefaultProcessRunner;
import com.example.summarizer_backend.engine.FfmpegFrameDecoder;
import com.example.summarizer_backend.engine.FfmpegSummaryComposer;
import com.example.summarizer_backend.engine.FfprobeMediaProbe;
import com.example.summarizer_backend.engine.Interfaces.FrameDecoder;
import com.example.summarizer_backend.engine.Interfaces.MediaProbe;
import com.example.summarizer_backend.engine.Interfaces.ProcessRunner;
import com.example.summarizer_backend.engine.Interfaces.SummaryComposer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * ffmpeg/ffprobe backed media engines.
 */
@Configuration
public class EngineConfig {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration FRAME_TIMEOUT = Duration.ofSeconds(30);

    @Bean
    public ProcessRunner processRunner() {
        return new DefaultProcessRunner();
    }

    @Bean
    public MediaProbe mediaProbe(ProcessRunner runner, ComposeProperties props, ObjectMapper objectMapper) {
        return new FfprobeMediaProbe(runner, props.getFfprobeBinary(), PROBE_TIMEOUT, objectMapper);
    }

    @Bean
    public FrameDecoder frameDecoder(ProcessRunner runner, ComposeProperties props) {
        return new FfmpegFrameDecoder(runner, props.getFfmpegBinary(), FRAME_TIMEOUT);
    }

    @Bean
    public SummaryComposer summaryComposer(ProcessRunner runner, ComposeProperties props) {
        return new FfmpegSummaryComposer(
                runner,
                props.getFfmpegBinary(),
                Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())),
                props.getMaxAttempts(),
                Duration.ofMillis(Math.max(1, props.getBackoffMillis())));
    }
}
