package com.example.summarizer_backend.engine.Interfaces;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes single still frames out of a video file.
 */
public interface FrameDecoder {

    /**
     * @param file        source video.
     * @param timestampMs seek position in milliseconds.
     * @param width       target width in pixels, aspect ratio is kept.
     * @return encoded image bytes.
     * @throws IOException when the frame at that position cannot be decoded.
     */
    byte[] decodeAt(Path file, long timestampMs, int width) throws IOException;
}
