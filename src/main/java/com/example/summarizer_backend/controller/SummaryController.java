package com.example.summarizer_backend.controller;

import com.example.summarizer_backend.dto.web.ProgressResponse;
import com.example.summarizer_backend.dto.web.SummaryCreateRequest;
import com.example.summarizer_backend.dto.web.SummaryResponse;
import com.example.summarizer_backend.service.SummaryJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/summaries")
@Tag(name = "Summaries", description = "Create, track and download scene summaries")
public class SummaryController {
    private final SummaryJobService summaryJobService;

    public SummaryController(SummaryJobService summaryJobService) {
        this.summaryJobService = summaryJobService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Queue a summary job")
    public ProgressResponse create(@Valid @RequestBody SummaryCreateRequest request) {
        return summaryJobService.create(request);
    }

    @GetMapping("/{id}/progress")
    @Operation(summary = "Status and progress of a job")
    public ProgressResponse progress(@PathVariable UUID id) {
        return summaryJobService.progress(id);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Full job record including selected scenes")
    public SummaryResponse get(@PathVariable UUID id) {
        return summaryJobService.result(id);
    }

    @GetMapping
    @Operation(summary = "Summaries of one source video, newest first")
    public List<SummaryResponse> list(@RequestParam String sourceKey) {
        return summaryJobService.listBySource(sourceKey);
    }

    @GetMapping("/{id}/download")
    @Operation(summary = "Download the summary video of a completed job")
    public ResponseEntity<Resource> download(@PathVariable UUID id) {
        SummaryJobService.Artifact artifact = summaryJobService.artifact(id);
        Resource body = new FileSystemResource(artifact.file());
        MediaType type = MediaTypeFactory.getMediaType(artifact.fileName()).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(type)
                .contentLength(artifact.size())
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.fileName()).build().toString())
                .body(body);
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a queued or running job")
    public ProgressResponse cancel(@PathVariable UUID id) {
        return summaryJobService.cancel(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Cancel and remove a job and its artifact")
    public void delete(@PathVariable UUID id) {
        summaryJobService.delete(id);
    }
}
