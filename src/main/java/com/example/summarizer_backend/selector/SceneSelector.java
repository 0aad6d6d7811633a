package com.example.summarizer_backend.selector;

import com.example.summarizer_backend.dto.SceneCandidate;

import java.util.List;

/**
 * Chooses the scenes that make up a summary.
 */
public interface SceneSelector {
    /**
     * Picks a subset of {@code candidates} within the configured budget.
     *
     * @param candidates scene candidates of one source, in any order.
     * @param cfg        budget, threshold and overflow policy.
     * @return non-overlapping scenes sorted by start, never empty.
     * @throws com.example.summarizer_backend.exception.NoMatchException when nothing can be selected.
     */
    List<SceneCandidate> select(List<SceneCandidate> candidates, SelectorConfig cfg);
}
