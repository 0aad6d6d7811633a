package com.example.summarizer_backend.engine;

import com.example.summarizer_backend.dto.ComposeResult;
import com.example.summarizer_backend.dto.SceneCandidate;
import com.example.summarizer_backend.dto.SourceVideo;
import com.example.summarizer_backend.engine.Interfaces.ProcessRunner;
import com.example.summarizer_backend.engine.Interfaces.SummaryComposer;
import com.example.summarizer_backend.exception.ComposeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cuts every interval into its own part file and joins the parts with the ffmpeg concat demuxer.
 * Parts are stream-copied when the source allows it and re-encoded otherwise; a failed copy falls
 * back to a re-encode of the same interval.
 */
public class FfmpegSummaryComposer implements SummaryComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegSummaryComposer.class);

    private static final Set<String> COPY_VIDEO_CODECS = Set.of("h264", "hevc");
    private static final Set<String> COPY_AUDIO_CODECS = Set.of("aac");
    private static final Set<String> COPY_TARGETS = Set.of("mp4", "mov");

    private final ProcessRunner runner;
    private final String ffmpegBin;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration backoff;

    public FfmpegSummaryComposer(ProcessRunner runner, String ffmpegBin, Duration timeout, int maxAttempts, Duration backoff) {
        this.runner = runner;
        this.ffmpegBin = ffmpegBin;
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(10);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff != null ? backoff : Duration.ofMillis(500);
    }

    @Override
    public ComposeResult compose(SourceVideo source, List<SceneCandidate> scenes, Path workDir, String outputFormat) {
        if (scenes == null || scenes.isEmpty()) {
            throw new ComposeException("Nothing to compose: no scenes selected", false);
        }
        String format = outputFormat.toLowerCase(Locale.ROOT);
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new ComposeException("Cannot create work directory " + workDir, false, e);
        }

        boolean copyEligible = canStreamCopy(source, format);
        boolean allCopied = copyEligible;
        List<Path> parts = new ArrayList<>(scenes.size());
        for (int i = 0; i < scenes.size(); i++) {
            SceneCandidate scene = scenes.get(i);
            Path part = workDir.resolve(String.format(Locale.ROOT, "part-%03d.%s", i, format));
            boolean copied = false;
            if (copyEligible) {
                copied = runStep("extract-copy#" + i, extractCommand(source.file(), scene, part, true)).succeeded()
                        && hasOutput(part);
                if (!copied) {
                    LOGGER.warn("COMPOSE stream copy failed part={} start={}ms end={}ms, re-encoding", i, scene.startMs(), scene.endMs());
                }
            }
            if (!copied) {
                allCopied = false;
                requireSuccess("extract-encode#" + i, runStep("extract-encode#" + i, extractCommand(source.file(), scene, part, false)));
            }
            requireNonEmpty(part);
            parts.add(part);
        }

        Path list = writeConcatList(workDir, parts);
        Path out = workDir.resolve("summary." + format);
        boolean concatCopied = runStep("concat-copy", concatCommand(list, out, true)).succeeded() && hasOutput(out);
        if (!concatCopied) {
            LOGGER.warn("COMPOSE concat copy failed, re-encoding {} parts", parts.size());
            requireSuccess("concat-encode", runStep("concat-encode", concatCommand(list, out, false)));
        }
        long size = requireNonEmpty(out);

        for (Path part : parts) {
            try {
                Files.deleteIfExists(part);
            } catch (IOException e) {
                LOGGER.debug("COMPOSE could not delete part={}: {}", part, e.toString());
            }
        }
        boolean streamCopied = allCopied && concatCopied;
        LOGGER.info("COMPOSE done parts={} bytes={} streamCopied={}", parts.size(), size, streamCopied);
        return new ComposeResult(out, size, streamCopied);
    }

    static boolean canStreamCopy(SourceVideo source, String format) {
        if (!COPY_TARGETS.contains(format) || !source.isMp4Family()) return false;
        String v = source.videoCodec() == null ? "" : source.videoCodec().toLowerCase(Locale.ROOT);
        if (!COPY_VIDEO_CODECS.contains(v)) return false;
        if (!source.hasAudio()) return true;
        return COPY_AUDIO_CODECS.contains(source.audioCodec().toLowerCase(Locale.ROOT));
    }

    List<String> extractCommand(Path src, SceneCandidate scene, Path part, boolean copy) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-hide_banner");
        cmd.add("-ss"); cmd.add(seconds(scene.startMs()));
        cmd.add("-i");  cmd.add(src.toAbsolutePath().toString());
        cmd.add("-t");  cmd.add(seconds(scene.durationMs()));
        cmd.add("-map"); cmd.add("0:v:0");
        cmd.add("-map"); cmd.add("0:a:0?");
        if (copy) {
            cmd.add("-c"); cmd.add("copy");
            cmd.add("-avoid_negative_ts"); cmd.add("make_zero");
        } else {
            addEncoderArgs(cmd);
        }
        cmd.add(part.toAbsolutePath().toString());
        return cmd;
    }

    List<String> concatCommand(Path list, Path out, boolean copy) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-hide_banner");
        cmd.add("-f"); cmd.add("concat");
        cmd.add("-safe"); cmd.add("0");
        cmd.add("-i"); cmd.add(list.toAbsolutePath().toString());
        if (copy) {
            cmd.add("-c"); cmd.add("copy");
        } else {
            addEncoderArgs(cmd);
        }
        cmd.add(out.toAbsolutePath().toString());
        return cmd;
    }

    private static void addEncoderArgs(List<String> cmd) {
        cmd.add("-c:v"); cmd.add("libx264");
        cmd.add("-preset"); cmd.add("veryfast");
        cmd.add("-crf"); cmd.add("20");
        cmd.add("-pix_fmt"); cmd.add("yuv420p");
        cmd.add("-c:a"); cmd.add("aac");
        cmd.add("-b:a"); cmd.add("128k");
        cmd.add("-movflags"); cmd.add("+faststart");
    }

    /**
     * Runs one ffmpeg step. Spawn/I-O failures and timeouts are transient and retried with backoff;
     * a non-zero exit is returned to the caller, which decides whether to fall back.
     */
    private ProcessRunner.Result runStep(String step, List<String> cmd) {
        LOGGER.info("FFmpeg command ({}): {}", step, String.join(" ", cmd));
        return Mono.fromCallable(() -> invoke(step, cmd))
                .retryWhen(Retry.backoff(maxAttempts - 1L, backoff)
                        .filter(t -> t instanceof ComposeException ce && ce.isTransient())
                        .doBeforeRetry(signal -> LOGGER.warn("COMPOSE retry step={} attempt={} cause={}",
                                step, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
    }

    private ProcessRunner.Result invoke(String step, List<String> cmd) {
        try {
            return runner.run(cmd, timeout);
        } catch (IOException e) {
            throw new ComposeException("ffmpeg " + step + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComposeException("ffmpeg " + step + " interrupted", false, e);
        }
    }

    private static void requireSuccess(String step, ProcessRunner.Result res) {
        if (!res.succeeded()) {
            throw new ComposeException("ffmpeg " + step + " exited with " + res.exitCode() + ": " + res.stderr().trim(), false);
        }
    }

    /** A copy that exits 0 but leaves nothing behind counts as a failed copy. */
    private static boolean hasOutput(Path file) {
        try {
            return Files.exists(file) && Files.size(file) > 0;
        } catch (IOException e) {
            LOGGER.debug("COMPOSE cannot stat {}: {}", file, e.toString());
            return false;
        }
    }

    private static long requireNonEmpty(Path file) {
        try {
            long size = Files.exists(file) ? Files.size(file) : 0L;
            if (size <= 0) {
                throw new ComposeException("ffmpeg produced no output: " + file.getFileName(), false);
            }
            return size;
        } catch (IOException e) {
            throw new ComposeException("Cannot stat " + file, true, e);
        }
    }

    private static Path writeConcatList(Path workDir, List<Path> parts) {
        StringBuilder sb = new StringBuilder();
        for (Path p : parts) {
            String escaped = p.toAbsolutePath().toString().replace("'", "'\\''");
            sb.append("file '").append(escaped).append("'\n");
        }
        Path list = workDir.resolve("concat.txt");
        try {
            Files.writeString(list, sb.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ComposeException("Cannot write concat list", true, e);
        }
        return list;
    }

    private static String seconds(long ms) {
        return String.format(Locale.ROOT, "%.3f", ms / 1000.0);
    }
}
