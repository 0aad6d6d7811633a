package com.example.summarizer_backend.aggregate;

import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.ScoredFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups per-frame scores into candidate scenes.
 * <p>
 * A run of consecutive frames scoring at or above the threshold forms one scene that starts at the first
 * frame and ends one stride after the last (clamped to the source duration). Runs closer than the merge gap
 * are joined. A scene's confidence is the mean score of every frame inside it, so the below-threshold frames of
 * a bridged gap pull it down. Scenes shorter than the minimum length are dropped last.
 */
public class SceneAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneAggregator.class);

    private final AggregatorConfig cfg;

    public SceneAggregator(AggregatorConfig cfg) {
        this.cfg = cfg;
    }

    /**
     * @param frames     scores in any order; they are sorted by timestamp first.
     * @param strideMs   sampling stride, the time one frame stands for.
     * @param durationMs source duration, scene ends never exceed it.
     * @param label      label attached to every produced scene, may be {@code null}.
     */
    public List<SceneCandidate> aggregate(List<ScoredFrame> frames, long strideMs, long durationMs, String label) {
        List<ScoredFrame> sorted = new ArrayList<>(frames);
        sorted.sort(Comparator.comparingLong(ScoredFrame::timestampMs));

        List<Run> runs = new ArrayList<>();
        Run current = null;
        long prevTs = Long.MIN_VALUE;
        for (ScoredFrame f : sorted) {
            boolean hit = f.score() >= cfg.threshold();
            boolean contiguous = current != null && f.timestampMs() - prevTs <= strideMs;
            if (hit) {
                if (current == null || !contiguous) {
                    current = new Run(f.timestampMs());
                    runs.add(current);
                }
                current.extendTo(Math.min(durationMs, f.timestampMs() + strideMs));
            } else {
                current = null;
            }
            prevTs = f.timestampMs();
        }

        List<Run> merged = new ArrayList<>();
        for (Run r : runs) {
            if (r.endMs <= r.startMs) continue;
            Run last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && r.startMs - last.endMs < cfg.mergeGapMs()) {
                last.absorb(r);
            } else {
                merged.add(r);
            }
        }

        List<SceneCandidate> out = new ArrayList<>();
        for (Run r : merged) {
            if (r.endMs - r.startMs < cfg.minSceneMs()) continue;
            out.add(new SceneCandidate(r.startMs, r.endMs, meanScore(sorted, r.startMs, r.endMs), label));
        }
        LOGGER.info("AGGREGATE frames={} runs={} merged={} scenes={} threshold={}",
                frames.size(), runs.size(), merged.size(), out.size(), cfg.threshold());
        return out;
    }

    static double meanScore(List<ScoredFrame> sorted, long startMs, long endMs) {
        double sum = 0.0;
        int count = 0;
        for (ScoredFrame f : sorted) {
            if (f.timestampMs() >= endMs) break;
            if (f.timestampMs() < startMs) continue;
            sum += f.score();
            count++;
        }
        double c = count == 0 ? 0.0 : sum / count;
        return Math.max(0.0, Math.min(1.0, c));
    }

    private static final class Run {
        final long startMs;
        long endMs;

        Run(long startMs) {
            this.startMs = startMs;
            this.endMs = startMs;
        }

        void extendTo(long end) {
            endMs = Math.max(endMs, end);
        }

        void absorb(Run other) {
            endMs = Math.max(endMs, other.endMs);
        }
    }
}
