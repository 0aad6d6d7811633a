package com.example.summarizer_backend.engine;

import com.example.summarizer_backend.engine.Interfaces.FrameDecoder;
import com.example.summarizer_backend.engine.Interfaces.ProcessRunner;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Seeks to a timestamp and pipes one scaled PNG frame out of ffmpeg.
 */
public class FfmpegFrameDecoder implements FrameDecoder {

    private final ProcessRunner runner;
    private final String ffmpegBin;
    private final Duration timeout;

    public FfmpegFrameDecoder(ProcessRunner runner, String ffmpegBin, Duration timeout) {
        this.runner = runner;
        this.ffmpegBin = ffmpegBin;
        this.timeout = timeout;
    }

    @Override
    public byte[] decodeAt(Path file, long timestampMs, int width) throws IOException {
        List<String> cmd = List.of(
                ffmpegBin, "-hide_banner", "-loglevel", "error",
                "-ss", String.format(Locale.ROOT, "%.3f", timestampMs / 1000.0),
                "-i", file.toAbsolutePath().toString(),
                "-frames:v", "1",
                "-vf", "scale=" + width + ":-2",
                "-f", "image2pipe",
                "-vcodec", "png",
                "-");
        ProcessRunner.Result res;
        try {
            res = runner.run(cmd, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("frame decode interrupted at " + timestampMs + "ms", e);
        }
        if (!res.succeeded() || res.stdout().length == 0) {
            throw new IOException("no frame at " + timestampMs + "ms (exit " + res.exitCode() + "): " + res.stderr().trim());
        }
        return res.stdout();
    }
}
