package com.example.summarizer_backend.exception;

import com.example.summarizer_backend.util.ErrorKind;

import java.util.UUID;

public class JobCancelledException extends SummarizationException {
    public JobCancelledException(UUID jobId) {
        super(ErrorKind.CANCELLED, "Job " + jobId + " was cancelled");
    }
}
