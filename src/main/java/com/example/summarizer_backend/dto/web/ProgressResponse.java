package com.example.summarizer_backend.dto.web;

import com.example.summarizer_backend.model.SummaryJob;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressResponse(UUID id, String status, int progressPercent, String stage, String errorKind, String errorMessage) {

    public static ProgressResponse of(SummaryJob job) {
        return new ProgressResponse(
                job.getId(),
                job.getStatus().name(),
                job.getProgressPercent(),
                job.getStage() == null ? null : job.getStage().name(),
                job.getErrorKind() == null ? null : job.getErrorKind().name(),
                job.getErrorMessage());
    }
}
