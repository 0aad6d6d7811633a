package com.example.summarizer_backend.dto;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Probed, read-only description of a decodable source video.
 *
 * @param file        local file the media was resolved to.
 * @param durationMs  total duration in milliseconds.
 * @param frameRate   average frame rate in frames per second.
 * @param width       width of the first video stream in pixels.
 * @param height      height of the first video stream in pixels.
 * @param container   container format name as reported by ffprobe (e.g. {@code mov,mp4,m4a,3gp}).
 * @param videoCodec  codec of the first video stream.
 * @param audioCodec  codec of the first audio stream, {@code null} when silent.
 * @param bitRate     overall bit rate in bits per second, {@code 0} when unknown.
 */
public record SourceVideo(Path file,
                          long durationMs,
                          double frameRate,
                          int width,
                          int height,
                          String container,
                          String videoCodec,
                          String audioCodec,
                          long bitRate) {

    public SourceVideo {
        if (durationMs <= 0) {
            throw new IllegalArgumentException("durationMs must be positive: " + durationMs);
        }
        if (frameRate <= 0) {
            throw new IllegalArgumentException("frameRate must be positive: " + frameRate);
        }
    }

    public boolean hasAudio() {
        return audioCodec != null && !audioCodec.isBlank();
    }

    /**
     * Whether the container is one of the ISO-BMFF family (mp4/mov) that can take stream-copied cuts.
     */
    public boolean isMp4Family() {
        if (container == null) {
            return false;
        }
        String c = container.toLowerCase(Locale.ROOT);
        return c.contains("mp4") || c.contains("mov");
    }
}
