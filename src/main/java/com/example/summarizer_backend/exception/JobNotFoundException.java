package com.example.summarizer_backend.exception;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(UUID jobId) {
        super("Summary job not found: " + jobId);
    }
}
