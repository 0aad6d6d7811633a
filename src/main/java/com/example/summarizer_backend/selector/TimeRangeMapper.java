package com.example.summarizer_backend.selector;

import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.selection.PercentRange;
import com.example.summarizer_backend.exception.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps percentage ranges onto absolute scenes of a source. Ranges are taken as given (confidence 1.0),
 * sorted and merged where they overlap or touch.
 */
public class TimeRangeMapper {

    public List<SceneCandidate> map(List<PercentRange> ranges, long durationMs) {
        if (ranges == null || ranges.isEmpty()) {
            throw new ValidationException("ranges_empty", "At least one time range is required");
        }
        List<Span> mapped = new ArrayList<>(ranges.size());
        for (PercentRange r : ranges) {
            long start = toMs(r.startPercent(), durationMs);
            long end = toMs(r.endPercent(), durationMs);
            if (start >= end) {
                throw new ValidationException("range_invalid",
                        "Time range " + r.label() + " is empty after mapping onto " + durationMs + "ms");
            }
            mapped.add(new Span(start, end, r));
        }
        mapped.sort(Comparator.comparingLong(Span::startMs).thenComparingLong(Span::endMs));

        List<Span> merged = new ArrayList<>();
        for (Span c : mapped) {
            Span last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && c.startMs() <= last.endMs()) {
                if (c.endMs() > last.endMs()) {
                    merged.set(merged.size() - 1, new Span(last.startMs(), c.endMs(),
                            new PercentRange(last.range().startPercent(), c.range().endPercent())));
                }
            } else {
                merged.add(c);
            }
        }

        List<SceneCandidate> scenes = new ArrayList<>(merged.size());
        for (Span m : merged) {
            scenes.add(new SceneCandidate(m.startMs(), m.endMs(), 1.0, m.range().label()));
        }
        return scenes;
    }

    private record Span(long startMs, long endMs, PercentRange range) {
    }

    static long toMs(double percent, long durationMs) {
        double clamped = Math.max(0.0, Math.min(100.0, percent));
        long ms = Math.round(clamped / 100.0 * durationMs);
        return Math.max(0L, Math.min(durationMs, ms));
    }
}
