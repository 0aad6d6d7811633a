package com.example.summarizer_backend.dto.selection;

import com.example.summarizer_backend.util.SelectionMode;

import java.util.Map;

/**
 * Validated selection request. One implementation per {@link SelectionMode}; strategies are looked up
 * by {@link #mode()}.
 */
public interface SelectionRequest {

    SelectionMode mode();

    /**
     * Payload in the wire shape, persisted with the job so the request can be rebuilt by the worker.
     */
    Map<String, Object> toPayload();
}
