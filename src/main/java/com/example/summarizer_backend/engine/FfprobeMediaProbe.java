package com.example.summarizer_backend.engine;

import com.example.summarizer_backend.dto.SourceVideo;
import com.example.summarizer_backend.engine.Interfaces.MediaProbe;
import com.example.summarizer_backend.engine.Interfaces.ProcessRunner;
import com.example.summarizer_backend.exception.ResourceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public class FfprobeMediaProbe implements MediaProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeMediaProbe.class);

    private final ProcessRunner runner;
    private final String ffprobeBin;
    private final Duration timeout;
    private final ObjectMapper om;

    public FfprobeMediaProbe(ProcessRunner runner, String ffprobeBin, Duration timeout, ObjectMapper om) {
        this.runner = runner;
        this.ffprobeBin = ffprobeBin;
        this.timeout = timeout;
        this.om = om;
    }

    @Override
    public SourceVideo probe(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ResourceException("Source video not found: " + file);
        }
        List<String> cmd = List.of(
                ffprobeBin, "-v", "error",
                "-print_format", "json",
                "-show_format", "-show_streams",
                file.toAbsolutePath().toString());

        ProcessRunner.Result res;
        try {
            res = runner.run(cmd, timeout);
        } catch (IOException e) {
            throw new ResourceException("ffprobe could not run on " + file.getFileName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceException("ffprobe interrupted", e);
        }
        if (!res.succeeded()) {
            throw new ResourceException("Source video is not decodable (ffprobe exit " + res.exitCode() + "): "
                    + res.stderr().trim());
        }
        try {
            return parse(file, om.readTree(res.stdout()));
        } catch (IOException e) {
            throw new ResourceException("Unreadable ffprobe output for " + file.getFileName(), e);
        }
    }

    SourceVideo parse(Path file, JsonNode root) {
        JsonNode video = null;
        JsonNode audio = null;
        for (JsonNode s : root.path("streams")) {
            String type = s.path("codec_type").asText("");
            if (video == null && "video".equals(type) && !isAttachedPicture(s)) video = s;
            if (audio == null && "audio".equals(type)) audio = s;
        }
        if (video == null) {
            throw new ResourceException("No video stream in " + file.getFileName());
        }
        JsonNode format = root.path("format");
        double durationSec = parseDouble(format.path("duration").asText(null));
        if (durationSec <= 0) durationSec = parseDouble(video.path("duration").asText(null));
        if (durationSec <= 0) {
            throw new ResourceException("Source video has no usable duration: " + file.getFileName());
        }
        double fps = parseRate(video.path("avg_frame_rate").asText(null));
        if (fps <= 0) fps = parseRate(video.path("r_frame_rate").asText(null));
        if (fps <= 0) {
            LOGGER.warn("PROBE no frame rate for file={}, assuming 25fps", file.getFileName());
            fps = 25.0;
        }

        SourceVideo sv = new SourceVideo(
                file,
                Math.round(durationSec * 1000.0),
                fps,
                video.path("width").asInt(0),
                video.path("height").asInt(0),
                format.path("format_name").asText(null),
                video.path("codec_name").asText(null),
                audio == null ? null : audio.path("codec_name").asText(null),
                format.path("bit_rate").asLong(0L));
        LOGGER.info("PROBE file={} durationMs={} fps={} size={}x{} container={} v={} a={}",
                file.getFileName(), sv.durationMs(), String.format(java.util.Locale.ROOT, "%.3f", fps),
                sv.width(), sv.height(), sv.container(), sv.videoCodec(), sv.audioCodec());
        return sv;
    }

    private static boolean isAttachedPicture(JsonNode stream) {
        return stream.path("disposition").path("attached_pic").asInt(0) == 1;
    }

    private static double parseDouble(String s) {
        if (s == null || s.isBlank() || "N/A".equals(s)) return -1;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** Parses ffprobe rationals like {@code 30000/1001}. */
    static double parseRate(String s) {
        if (s == null || s.isBlank()) return -1;
        int slash = s.indexOf('/');
        if (slash < 0) return parseDouble(s);
        double num = parseDouble(s.substring(0, slash));
        double den = parseDouble(s.substring(slash + 1));
        if (num <= 0 || den <= 0) return -1;
        return num / den;
    }
}
