package com.example.summarizer_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Scratch directory of one job run, {@code <workRoot>/<jobId>}. Closing it deletes the directory and
 * everything below it.
 */
public final class JobWorkspace implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobWorkspace.class);

    private final Path dir;

    private JobWorkspace(Path dir) {
        this.dir = dir;
    }

    public static JobWorkspace open(Path workRoot, UUID jobId) {
        Path dir = workRoot.toAbsolutePath().normalize().resolve(jobId.toString());
        try {
            FileSystemUtils.deleteRecursively(dir);
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create job workspace " + dir, e);
        }
        return new JobWorkspace(dir);
    }

    public Path dir() {
        return dir;
    }

    @Override
    public void close() {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            LOGGER.error("WORKSPACE cleanup failed dir={}: {}", dir, e.toString(), e);
            throw new UncheckedIOException("Cannot delete job workspace " + dir, e);
        }
    }
}
