package com.example.summarizer_backend.service;

import com.example.summarizer_backend.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStorageServiceTest {

    @TempDir
    Path base;

    private LocalStorageService storage;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(base, "raw", "out");
    }

    @Test
    void uploadPublishesWholeFileAndLeavesNoTempBehind() throws Exception {
        Path src = Files.writeString(base.resolve("summary.mp4"), "summary-bytes");

        storage.uploadToOut(src, "summaries/job.mp4");

        assertThat(storage.existsInOut("summaries/job.mp4")).isTrue();
        assertThat(storage.sizeOut("summaries/job.mp4")).isEqualTo(13L);
        assertThat(Files.exists(base.resolve("out/summaries/job.mp4.part"))).isFalse();
        assertThat(Files.exists(src)).isTrue();
    }

    @Test
    void deleteIsIdempotent() throws Exception {
        Path src = Files.writeString(base.resolve("summary.mp4"), "x");
        storage.uploadToOut(src, "summaries/job.mp4");

        storage.deleteOut("summaries/job.mp4");
        storage.deleteOut("summaries/job.mp4");

        assertThat(storage.existsInOut("summaries/job.mp4")).isFalse();
    }

    @Test
    void rawKeysResolveBelowRawDirectory() throws Exception {
        Files.writeString(base.resolve("raw/holiday.mp4"), "video");

        assertThat(storage.existsInRaw("holiday.mp4")).isTrue();
        assertThat(storage.existsInRaw("/holiday.mp4")).isTrue();
        assertThat(storage.resolveRaw("holiday.mp4")).isEqualTo(base.toAbsolutePath().normalize().resolve("raw/holiday.mp4"));
        assertThat(storage.existsInRaw("missing.mp4")).isFalse();
    }

    @Test
    void traversalAndBlankKeysAreRejected() {
        assertThatThrownBy(() -> storage.resolveRaw("../out/secret.mp4")).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> storage.resolveOut("a/../../raw/x.mp4")).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> storage.resolveOut(" ")).isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> storage.resolveOut(".")).isInstanceOf(StorageException.class);
    }

    @Test
    void sizeOfMissingArtifactIsAStorageError() {
        assertThatThrownBy(() -> storage.sizeOut("summaries/none.mp4")).isInstanceOf(StorageException.class);
    }
}
