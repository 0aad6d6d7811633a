package com.example.summarizer_backend.exception;

public class JobConflictException extends RuntimeException {
    public JobConflictException(String message) {
        super(message);
    }
}
