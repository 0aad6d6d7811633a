package com.example.summarizer_backend.exception;

import com.example.summarizer_backend.util.ErrorKind;

public class NoMatchException extends SummarizationException {
    public NoMatchException(String message) {
        super(ErrorKind.NO_MATCH, message);
    }
}
