package com.example.summarizer_backend.aggregate;

/**
 * Settings for {@link SceneAggregator}.
 *
 * @param threshold  minimum frame score for a frame to belong to a scene.
 * @param minSceneMs scenes shorter than this are dropped.
 * @param mergeGapMs scenes separated by less than this are merged into one.
 */
public record AggregatorConfig(double threshold, long minSceneMs, long mergeGapMs) {

    public AggregatorConfig {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be in [0,1]: " + threshold);
        }
        if (minSceneMs < 0 || mergeGapMs < 0) {
            throw new IllegalArgumentException("minSceneMs and mergeGapMs must not be negative");
        }
    }
}
