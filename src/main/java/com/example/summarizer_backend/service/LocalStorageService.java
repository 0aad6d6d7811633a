package com.example.summarizer_backend.service;

import com.example.summarizer_backend.exception.StorageException;
import com.example.summarizer_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed storage below one base directory. Uploads land in a temp file next to the target and
 * are moved into place, so a reader never sees a half-written artifact.
 */
public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path rawDir;
    private final Path outDir;

    public LocalStorageService(Path baseDir, String rawPrefix, String outPrefix) {
        Path base = baseDir.toAbsolutePath().normalize();
        this.rawDir = base.resolve(rawPrefix).normalize();
        this.outDir = base.resolve(outPrefix).normalize();
        try {
            Files.createDirectories(rawDir);
            Files.createDirectories(outDir);
            LOGGER.info("LocalStorageService ready. base={}, raw={}, out={}", base, rawDir, outDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolveRaw(String objectKey) {
        return safeResolve(rawDir, objectKey);
    }

    @Override
    public Path resolveOut(String objectKey) {
        return safeResolve(outDir, objectKey);
    }

    @Override
    public boolean existsInRaw(String objectKey) {
        return Files.isRegularFile(safeResolve(rawDir, objectKey));
    }

    @Override
    public boolean existsInOut(String objectKey) {
        return Files.isRegularFile(safeResolve(outDir, objectKey));
    }

    @Override
    public void uploadToOut(Path sourceFile, String objectKey) {
        Path target = safeResolve(outDir, objectKey);
        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.createDirectories(target.getParent());
            Files.copy(sourceFile, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new StorageException("Upload failed to " + target, e);
        }
    }

    @Override
    public void deleteOut(String objectKey) {
        Path p = safeResolve(outDir, objectKey);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    @Override
    public long sizeOut(String objectKey) {
        Path p = safeResolve(outDir, objectKey);
        try {
            return Files.size(p);
        } catch (IOException e) {
            throw new StorageException("Cannot stat " + p, e);
        }
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }
}
