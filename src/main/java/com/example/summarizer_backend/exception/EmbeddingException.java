package com.example.summarizer_backend.exception;

import com.example.summarizer_backend.util.ErrorKind;

public class EmbeddingException extends SummarizationException {
    public EmbeddingException(String message) {
        super(ErrorKind.EMBEDDING, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING, message, cause);
    }
}
