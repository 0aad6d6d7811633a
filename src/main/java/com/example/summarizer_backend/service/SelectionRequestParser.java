package com.example.summarizer_backend.service;

import com.example.summarizer_backend.catalog.CategoryCatalog;
import com.example.summarizer_backend.catalog.SummaryCategory;
import com.example.summarizer_backend.config.ComposeProperties;
import com.example.summarizer_backend.dto.selection.CategoryRequest;
import com.example.summarizer_backend.dto.selection.PercentRange;
import com.example.summarizer_backend.dto.selection.SelectionRequest;
import com.example.summarizer_backend.dto.selection.TextPromptRequest;
import com.example.summarizer_backend.dto.selection.TimeRangesRequest;
import com.example.summarizer_backend.exception.ValidationException;
import com.example.summarizer_backend.util.SelectionMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the wire form of a summary request ({@code mode} + {@code payload}) into a typed
 * {@link SelectionRequest}. Everything that can be checked without the source video is checked here,
 * before a job exists.
 */
@Component
public class SelectionRequestParser {
    public static final int MAX_PROMPT_LENGTH = 500;
    public static final int MAX_TITLE_LENGTH = 255;
    public static final int MAX_RANGES = 50;

    private final CategoryCatalog catalog;
    private final ObjectMapper mapper;
    private final List<String> supportedFormats;

    public SelectionRequestParser(CategoryCatalog catalog, ObjectMapper mapper, ComposeProperties compose) {
        this.catalog = catalog;
        this.mapper = mapper;
        this.supportedFormats = compose.getSupportedFormats().stream()
                .map(f -> f.toLowerCase(Locale.ROOT))
                .toList();
    }

    public SelectionRequest parse(String mode, JsonNode payload) {
        SelectionMode m = SelectionMode.fromWireName(mode)
                .orElseThrow(() -> new ValidationException("mode_invalid",
                        "Unknown mode '" + mode + "', expected one of text-prompt, category, time-range"));
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("payload_missing", "payload must be a JSON object");
        }
        return switch (m) {
            case TEXT_PROMPT -> parsePrompt(payload);
            case CATEGORY -> parseCategory(payload);
            case TIME_RANGE -> parseRanges(payload);
        };
    }

    /**
     * Rebuilds a request from the payload stored with a job.
     */
    public SelectionRequest fromStored(SelectionMode mode, Map<String, Object> payload) {
        return parse(mode.wireName(), mapper.valueToTree(payload == null ? Map.of() : payload));
    }

    public String validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title_missing", "title is required");
        }
        String t = title.trim();
        if (t.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("title_too_long", "title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        return t;
    }

    public String validateSourceKey(String sourceKey) {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new ValidationException("source_missing", "sourceKey is required");
        }
        String key = sourceKey.trim();
        int dot = key.lastIndexOf('.');
        String ext = dot < 0 ? "" : key.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!supportedFormats.contains(ext)) {
            throw new ValidationException("format_unsupported",
                    "Unsupported video format '" + ext + "', supported: " + String.join(", ", supportedFormats));
        }
        return key;
    }

    private TextPromptRequest parsePrompt(JsonNode payload) {
        JsonNode node = payload.get("prompt");
        String prompt = node == null || !node.isTextual() ? null : node.asText().trim();
        if (prompt == null || prompt.isEmpty()) {
            throw new ValidationException("prompt_empty", "prompt must be a non-empty string");
        }
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            throw new ValidationException("prompt_too_long", "prompt exceeds " + MAX_PROMPT_LENGTH + " characters");
        }
        return new TextPromptRequest(prompt);
    }

    private CategoryRequest parseCategory(JsonNode payload) {
        JsonNode node = payload.get("category_id");
        String id = node == null || !node.isTextual() ? null : node.asText();
        SummaryCategory category = catalog.find(id)
                .orElseThrow(() -> new ValidationException("category_unknown",
                        "Unknown category_id '" + id + "', expected one of " + String.join(", ", catalog.ids())));
        return new CategoryRequest(category);
    }

    private TimeRangesRequest parseRanges(JsonNode payload) {
        JsonNode arr = payload.get("ranges");
        if (arr == null || !arr.isArray() || arr.isEmpty()) {
            throw new ValidationException("ranges_empty", "ranges must be a non-empty array");
        }
        if (arr.size() > MAX_RANGES) {
            throw new ValidationException("ranges_too_many", "at most " + MAX_RANGES + " ranges are allowed");
        }
        List<PercentRange> ranges = new ArrayList<>(arr.size());
        int i = 0;
        for (JsonNode r : arr) {
            double start = percent(r, "start_percent", i);
            double end = percent(r, "end_percent", i);
            if (start >= end) {
                throw new ValidationException("range_invalid",
                        "ranges[" + i + "]: start_percent must be less than end_percent");
            }
            ranges.add(new PercentRange(start, end));
            i++;
        }
        return new TimeRangesRequest(ranges);
    }

    private static double percent(JsonNode range, String field, int index) {
        JsonNode v = range == null ? null : range.get(field);
        if (v == null || !v.isNumber()) {
            throw new ValidationException("range_invalid", "ranges[" + index + "]." + field + " must be a number");
        }
        double d = v.asDouble();
        if (Double.isNaN(d) || d < 0.0 || d > 100.0) {
            throw new ValidationException("range_invalid", "ranges[" + index + "]." + field + " must be within [0, 100]");
        }
        return d;
    }
}
