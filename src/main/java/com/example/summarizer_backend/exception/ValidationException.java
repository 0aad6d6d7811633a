package com.example.summarizer_backend.exception;

import com.example.summarizer_backend.util.ErrorKind;

/**
 * Malformed summary request. Raised before any job is created.
 */
public class ValidationException extends SummarizationException {
    private final String code;

    public ValidationException(String code, String message) {
        super(ErrorKind.VALIDATION, message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
