package com.example.summarizer_backend.util;

public enum ErrorKind {
    VALIDATION,
    RESOURCE,
    NO_MATCH,
    COMPOSE,
    EMBEDDING,
    CANCELLED,
    INTERNAL
}
