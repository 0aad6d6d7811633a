package com.example.summarizer_backend.dto.selection;

import com.example.summarizer_backend.util.SelectionMode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record TimeRangesRequest(List<PercentRange> ranges) implements SelectionRequest {

    public TimeRangesRequest {
        ranges = List.copyOf(ranges);
    }

    @Override
    public SelectionMode mode() {
        return SelectionMode.TIME_RANGE;
    }

    @Override
    public Map<String, Object> toPayload() {
        List<Map<String, Object>> out = ranges.stream()
                .map(r -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("start_percent", r.startPercent());
                    m.put("end_percent", r.endPercent());
                    return m;
                })
                .toList();
        return Map.of("ranges", out);
    }
}
