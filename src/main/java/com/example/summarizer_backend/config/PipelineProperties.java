package com.example.summarizer_backend.config;

import com.example.summarizer_backend.selector.OverflowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the summarization pipeline: sampling stride, match threshold, anti-flicker
 * settings and the selection budget.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Sampling sampling = new Sampling();
    private Matching matching = new Matching();
    private Selection selection = new Selection();

    public Sampling getSampling() {
        return sampling;
    }

    public void setSampling(Sampling sampling) {
        this.sampling = sampling;
    }

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    public Selection getSelection() {
        return selection;
    }

    public void setSelection(Selection selection) {
        this.selection = selection;
    }

    public static class Sampling {
        /** Sample one frame every N source frames. */
        private int strideFrames = 30;
        /** Fixed time delta between samples; takes precedence over {@link #strideFrames} when positive. */
        private double strideSeconds = 0.0;
        private int maxFrames = 3600;
        private int frameWidth = 224;

        public int getStrideFrames() {
            return strideFrames;
        }

        public void setStrideFrames(int strideFrames) {
            this.strideFrames = strideFrames;
        }

        public double getStrideSeconds() {
            return strideSeconds;
        }

        public void setStrideSeconds(double strideSeconds) {
            this.strideSeconds = strideSeconds;
        }

        public int getMaxFrames() {
            return maxFrames;
        }

        public void setMaxFrames(int maxFrames) {
            this.maxFrames = maxFrames;
        }

        public int getFrameWidth() {
            return frameWidth;
        }

        public void setFrameWidth(int frameWidth) {
            this.frameWidth = frameWidth;
        }
    }

    public static class Matching {
        private double threshold = 0.25;
        private double minSceneSeconds = 1.0;
        private double mergeGapSeconds = 2.0;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public double getMinSceneSeconds() {
            return minSceneSeconds;
        }

        public void setMinSceneSeconds(double minSceneSeconds) {
            this.minSceneSeconds = minSceneSeconds;
        }

        public double getMergeGapSeconds() {
            return mergeGapSeconds;
        }

        public void setMergeGapSeconds(double mergeGapSeconds) {
            this.mergeGapSeconds = mergeGapSeconds;
        }
    }

    public static class Selection {
        private int targetDurationSeconds = 60;
        private OverflowPolicy overflowPolicy = OverflowPolicy.ADMIT_THEN_STOP;
        private double minTrimSeconds = 1.0;

        public int getTargetDurationSeconds() {
            return targetDurationSeconds;
        }

        public void setTargetDurationSeconds(int targetDurationSeconds) {
            this.targetDurationSeconds = targetDurationSeconds;
        }

        public OverflowPolicy getOverflowPolicy() {
            return overflowPolicy;
        }

        public void setOverflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
        }

        public double getMinTrimSeconds() {
            return minTrimSeconds;
        }

        public void setMinTrimSeconds(double minTrimSeconds) {
            this.minTrimSeconds = minTrimSeconds;
        }
    }
}
