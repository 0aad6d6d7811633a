package com.example.summarizer_backend.service.Interfaces;

import java.nio.file.Path;

/**
 * Object storage seen by the pipeline: source videos live under "raw", summaries under "out".
 * Keys are relative, forward-slash separated paths.
 */
public interface StorageService {

    /** Local path of a source object, for ffmpeg/ffprobe. */
    Path resolveRaw(String objectKey);

    Path resolveOut(String objectKey);

    boolean existsInRaw(String objectKey);

    boolean existsInOut(String objectKey);

    /** Copies a finished artifact into "out", creating directories as needed. */
    void uploadToOut(Path sourceFile, String objectKey);

    /** No-op when the object does not exist. */
    void deleteOut(String objectKey);

    long sizeOut(String objectKey);
}
