package com.example.summarizer_backend.exception;

import com.example.summarizer_backend.util.ErrorKind;

/**
 * Source video is missing, corrupt or cannot be decoded.
 */
public class ResourceException extends SummarizationException {
    public ResourceException(String message) {
        super(ErrorKind.RESOURCE, message);
    }

    public ResourceException(String message, Throwable cause) {
        super(ErrorKind.RESOURCE, message, cause);
    }
}
