package com.example.summarizer_backend.service.strategy;

import com.example.summarizer_backend.util.PipelineStage;

/**
 * Stage boundary hooks a running job exposes to the code it drives.
 */
public interface JobCheckpoint {

    /**
     * @throws com.example.summarizer_backend.exception.JobCancelledException when a cancel is pending.
     */
    void throwIfCancelled();

    /**
     * Records that {@code stage} finished, then checks for cancellation.
     */
    void reached(PipelineStage stage);
}
