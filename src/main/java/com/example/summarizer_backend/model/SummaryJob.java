package com.example.summarizer_backend.model;

import com.example.summarizer_backend.util.ErrorKind;
import com.example.summarizer_backend.util.JobStatus;
import com.example.summarizer_backend.util.PipelineStage;
import com.example.summarizer_backend.util.SelectionMode;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
        name = "summary_job",
        indexes = {
                @Index(name = "idx_summary_job_status_created", columnList = "status, created_at"),
                @Index(name = "idx_summary_job_source", columnList = "source_key")
        }
)
public class SummaryJob {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "source_key", nullable = false, length = 1024)
    private String sourceKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 32)
    private SelectionMode mode;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "request_data")
    private Map<String, Object> requestData;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", length = 32)
    private PipelineStage stage;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    // Each entry: startMs, endMs, confidence, matchedLabel
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "selected_scenes")
    private List<Map<String, Object>> selectedScenes;

    @Column(name = "artifact_key", length = 1024)
    private String artifactKey;

    @Column(name = "artifact_size")
    private Long artifactSize;

    @Column(name = "summary_duration_ms")
    private Long summaryDurationMs;

    @Column(name = "output_format", nullable = false, length = 16)
    private String outputFormat;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 32)
    private ErrorKind errorKind;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected SummaryJob() {}

    public SummaryJob(String title, String sourceKey, SelectionMode mode, Map<String, Object> requestData, String outputFormat) {
        this.title = title;
        this.sourceKey = sourceKey;
        this.mode = mode;
        this.requestData = requestData;
        this.outputFormat = outputFormat;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getSourceKey() { return sourceKey; }
    public void setSourceKey(String sourceKey) { this.sourceKey = sourceKey; }

    public SelectionMode getMode() { return mode; }
    public void setMode(SelectionMode mode) { this.mode = mode; }

    public Map<String, Object> getRequestData() { return requestData; }
    public void setRequestData(Map<String, Object> requestData) { this.requestData = requestData; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public int getProgressPercent() { return progressPercent; }
    public void setProgressPercent(int progressPercent) { this.progressPercent = progressPercent; }

    public PipelineStage getStage() { return stage; }
    public void setStage(PipelineStage stage) { this.stage = stage; }

    public boolean isCancelRequested() { return cancelRequested; }
    public void setCancelRequested(boolean cancelRequested) { this.cancelRequested = cancelRequested; }

    public List<Map<String, Object>> getSelectedScenes() { return selectedScenes; }
    public void setSelectedScenes(List<Map<String, Object>> selectedScenes) { this.selectedScenes = selectedScenes; }

    public String getArtifactKey() { return artifactKey; }
    public void setArtifactKey(String artifactKey) { this.artifactKey = artifactKey; }

    public Long getArtifactSize() { return artifactSize; }
    public void setArtifactSize(Long artifactSize) { this.artifactSize = artifactSize; }

    public Long getSummaryDurationMs() { return summaryDurationMs; }
    public void setSummaryDurationMs(Long summaryDurationMs) { this.summaryDurationMs = summaryDurationMs; }

    public String getOutputFormat() { return outputFormat; }
    public void setOutputFormat(String outputFormat) { this.outputFormat = outputFormat; }

    public ErrorKind getErrorKind() { return errorKind; }
    public void setErrorKind(ErrorKind errorKind) { this.errorKind = errorKind; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = JobStatus.QUEUED;
    }
}
