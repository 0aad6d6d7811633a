package com.example.summarizer_backend.exception;

import com.example.summarizer_backend.util.ErrorKind;

/**
 * Base type for failures that end up on a summary job record.
 */
public abstract class SummarizationException extends RuntimeException {
    private final ErrorKind kind;

    protected SummarizationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SummarizationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
