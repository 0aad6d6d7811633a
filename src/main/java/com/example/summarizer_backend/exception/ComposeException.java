package com.example.summarizer_backend.exception;

import com.example.summarizer_backend.util.ErrorKind;

/**
 * Extraction or concatenation failure while producing the summary artifact.
 * Transient failures (process I/O, timeouts) are retried by the composer.
 */
public class ComposeException extends SummarizationException {
    private final boolean transientFailure;

    public ComposeException(String message, boolean transientFailure) {
        super(ErrorKind.COMPOSE, message);
        this.transientFailure = transientFailure;
    }

    public ComposeException(String message, boolean transientFailure, Throwable cause) {
        super(ErrorKind.COMPOSE, message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
