package com.example.summarizer_backend.sampler;

/**
 * Time delta between two sampled frames.
 *
 * @param strideMs distance between consecutive samples in milliseconds, always positive.
 */
public record SamplingStride(long strideMs) {

    public SamplingStride {
        if (strideMs <= 0) {
            throw new IllegalArgumentException("strideMs must be positive: " + strideMs);
        }
    }

    public static SamplingStride ofSeconds(double seconds) {
        return new SamplingStride(Math.max(1L, Math.round(seconds * 1000.0)));
    }

    /**
     * Stride that skips {@code frames} source frames at the given frame rate.
     */
    public static SamplingStride ofFrames(int frames, double frameRate) {
        if (frames <= 0 || frameRate <= 0) {
            throw new IllegalArgumentException("frames and frameRate must be positive");
        }
        return new SamplingStride(Math.max(1L, Math.round(frames / frameRate * 1000.0)));
    }

    /**
     * Widens this stride so that {@code durationMs} yields at most {@code maxFrames} samples.
     */
    public SamplingStride capped(long durationMs, int maxFrames) {
        if (maxFrames <= 0 || sampleCount(durationMs) <= maxFrames) {
            return this;
        }
        long widened = (durationMs + maxFrames - 1) / maxFrames;
        return new SamplingStride(Math.max(strideMs, widened));
    }

    /** Number of timestamps {@code 0, stride, 2*stride, ..} strictly below {@code durationMs}. */
    public long sampleCount(long durationMs) {
        if (durationMs <= 0) return 0;
        return (durationMs + strideMs - 1) / strideMs;
    }
}
