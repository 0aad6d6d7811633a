package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.selection.TimeRangesRequest;
import com.example.summarizer_backend.selector.TimeRangeMapper;
import com.example.summarizer_backend.util.PipelineStage;
import com.example.summarizer_backend.util.SelectionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Explicit ranges, mapped straight onto the source. No frames are sampled or embedded.
 */
@Component
public class TimeRangeSelectionStrategy implements SceneSelectionStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimeRangeSelectionStrategy.class);

    private final TimeRangeMapper mapper;

    public TimeRangeSelectionStrategy(TimeRangeMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public SelectionMode mode() {
        return SelectionMode.TIME_RANGE;
    }

    @Override
    public List<SceneCandidate> select(SelectionContext ctx) {
        TimeRangesRequest req = (TimeRangesRequest) ctx.request();
        List<SceneCandidate> scenes = mapper.map(req.ranges(), ctx.source().durationMs());
        LOGGER.info("SELECT jobId={} mode={} ranges={} scenes={}", ctx.jobId(), mode(), req.ranges().size(), scenes.size());
        ctx.checkpoint().reached(PipelineStage.SELECT);
        return scenes;
    }
}
