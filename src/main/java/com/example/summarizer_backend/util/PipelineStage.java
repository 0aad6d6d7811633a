package com.example.summarizer_backend.util;

/**
 * Coarse checkpoints of a summary run. The percentage is written to the job once the stage completes.
 */
public enum PipelineStage {
    PROBE(10),
    EMBED_FRAMES(45),
    SCORE(55),
    AGGREGATE(65),
    SELECT(75),
    COMPOSE(90),
    PUBLISH(95);

    private final int progressPercent;

    PipelineStage(int progressPercent) {
        this.progressPercent = progressPercent;
    }

    public int progressPercent() {
        return progressPercent;
    }
}
