package com.example.summarizer_backend.selector;

/**
 * Configuration for the {@link SceneSelector}.
 *
 * @param targetDurationMs selection budget in milliseconds.
 * @param threshold        candidates below this confidence are never selected.
 * @param overflowPolicy   behaviour when a candidate does not fit the remaining budget.
 * @param minTrimMs        a trimmed scene is admitted only when the remainder is strictly longer than this under {@link OverflowPolicy#TRIM}.
 */
public record SelectorConfig(long targetDurationMs,
                             double threshold,
                             OverflowPolicy overflowPolicy,
                             long minTrimMs) {

    public SelectorConfig {
        if (targetDurationMs <= 0) {
            throw new IllegalArgumentException("targetDurationMs must be positive: " + targetDurationMs);
        }
        if (overflowPolicy == null) {
            overflowPolicy = OverflowPolicy.ADMIT_THEN_STOP;
        }
    }

    public static SelectorConfig defaults() {
        return new SelectorConfig(60_000L, 0.25, OverflowPolicy.ADMIT_THEN_STOP, 1_000L);
    }
}
