package com.example.summarizer_backend.engine.Interfaces;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external binary (ffmpeg, ffprobe) to completion.
 */
public interface ProcessRunner {

    /**
     * Starts {@code command} and waits at most {@code timeout} for it to exit.
     *
     * @return exit code plus captured output. A non-zero exit is returned, not thrown.
     * @throws IOException          when the process cannot be started or its output cannot be read.
     * @throws ProcessTimeoutException when the process had to be killed after {@code timeout}.
     */
    Result run(List<String> command, Duration timeout) throws IOException, InterruptedException;

    /**
     * @param exitCode process exit code.
     * @param stdout   raw standard output (frame decoding pipes PNG bytes through it).
     * @param stderr   standard error as text.
     */
    record Result(int exitCode, byte[] stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    class ProcessTimeoutException extends IOException {
        public ProcessTimeoutException(String message) {
            super(message);
        }
    }
}
