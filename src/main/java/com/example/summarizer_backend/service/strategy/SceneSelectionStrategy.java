package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.util.SelectionMode;

import java.util.List;

/**
 * One way of choosing scenes, bound to a single {@link SelectionMode}.
 */
public interface SceneSelectionStrategy {

    SelectionMode mode();

    /**
     * @return non-overlapping scenes sorted by start, never empty.
     */
    List<SceneCandidate> select(SelectionContext ctx);
}
