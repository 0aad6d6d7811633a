package com.example.summarizer_backend.dto.web;

import com.example.summarizer_backend.model.SummaryJob;
import com.example.summarizer_backend.service.SummaryJobStore;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record SummaryResponse(
        UUID id,
        String title,
        String sourceKey,
        String mode,
        Map<String, Object> payload,
        String status,
        int progressPercent,
        List<SceneResponse> selectedScenes,
        Long summaryDurationMs,
        String artifactKey,
        Long artifactSize,
        String outputFormat,
        String errorKind,
        String errorMessage,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
    public static SummaryResponse of(SummaryJob j) {
        return new SummaryResponse(
                j.getId(),
                j.getTitle(),
                j.getSourceKey(),
                j.getMode().wireName(),
                j.getRequestData(),
                j.getStatus().name(),
                j.getProgressPercent(),
                SummaryJobStore.scenesOf(j).stream().map(SceneResponse::of).toList(),
                j.getSummaryDurationMs(),
                j.getArtifactKey(),
                j.getArtifactSize(),
                j.getOutputFormat(),
                j.getErrorKind() == null ? null : j.getErrorKind().name(),
                j.getErrorMessage(),
                j.getCreatedAt(),
                j.getStartedAt(),
                j.getCompletedAt()
        );
    }
}
