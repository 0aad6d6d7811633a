package com.example.summarizer_backend.selector;

import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.exception.NoMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Greedy selection by confidence under a duration budget. Ties break on the earlier start, so the same
 * candidates always give the same summary.
 */
public class BudgetedSceneSelector implements SceneSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(BudgetedSceneSelector.class);

    static final Comparator<SceneCandidate> BY_CONFIDENCE = Comparator
            .comparingDouble(SceneCandidate::confidence).reversed()
            .thenComparingLong(SceneCandidate::startMs)
            .thenComparingLong(SceneCandidate::endMs);

    @Override
    public List<SceneCandidate> select(List<SceneCandidate> candidates, SelectorConfig cfg) {
        List<SceneCandidate> ranked = new ArrayList<>();
        for (SceneCandidate c : candidates) {
            if (c != null && c.confidence() >= cfg.threshold()) {
                ranked.add(c);
            }
        }
        if (ranked.isEmpty()) {
            throw new NoMatchException(String.format(Locale.ROOT,
                    "No scene matched the query (0 of %d candidates at or above threshold %.2f)",
                    candidates.size(), cfg.threshold()));
        }
        ranked.sort(BY_CONFIDENCE);

        long budget = cfg.targetDurationMs();
        long total = 0L;
        List<SceneCandidate> accepted = new ArrayList<>();
        for (SceneCandidate c : ranked) {
            if (total >= budget) break;
            if (overlapsAny(c, accepted)) {
                LOGGER.trace("selector skip start={} end={} overlaps accepted scene", c.startMs(), c.endMs());
                continue;
            }
            long remaining = budget - total;
            if (c.durationMs() <= remaining) {
                accepted.add(c);
                total += c.durationMs();
                continue;
            }
            if (cfg.overflowPolicy() == OverflowPolicy.STRICT) {
                continue;
            }
            if (cfg.overflowPolicy() == OverflowPolicy.TRIM) {
                if (remaining > cfg.minTrimMs()) {
                    accepted.add(c.withEnd(c.startMs() + remaining));
                    total += remaining;
                }
                break;
            }
            accepted.add(c);
            total += c.durationMs();
            break;
        }

        if (accepted.isEmpty()) {
            throw new NoMatchException("No matching scene fits the " + budget + "ms budget");
        }
        accepted.sort(Comparator.comparingLong(SceneCandidate::startMs));
        LOGGER.debug("BudgetedSceneSelector candidates={} eligible={} selected={} totalMs={} budgetMs={} policy={}",
                candidates.size(), ranked.size(), accepted.size(), total, budget, cfg.overflowPolicy());
        return accepted;
    }

    private static boolean overlapsAny(SceneCandidate c, List<SceneCandidate> accepted) {
        for (SceneCandidate a : accepted) {
            if (a.overlaps(c)) return true;
        }
        return false;
    }
}
