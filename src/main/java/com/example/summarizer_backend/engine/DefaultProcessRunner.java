package com.example.summarizer_backend.engine;

import com.example.summarizer_backend.engine.Interfaces.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessRunner} on top of {@link ProcessBuilder}. Both output streams are drained on daemon
 * threads so a chatty ffmpeg never blocks on a full pipe.
 */
public class DefaultProcessRunner implements ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultProcessRunner.class);
    private static final int STDERR_TAIL_CHARS = 4000;

    @Override
    public Result run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        String name = command.isEmpty() ? "?" : command.get(0);
        Process p = new ProcessBuilder(command).redirectErrorStream(false).start();

        ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
        StringBuilder errBuf = new StringBuilder();

        Thread tOut = new Thread(() -> {
            try (InputStream in = p.getInputStream()) {
                in.transferTo(outBuf);
            } catch (IOException e) {
                LOGGER.debug("[{}-out] stream closed: {}", name, e.toString());
            }
        });
        Thread tErr = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
                br.lines().forEach(line -> {
                    LOGGER.debug("[{}-err] {}", name, line);
                    synchronized (errBuf) {
                        appendTail(errBuf, line, STDERR_TAIL_CHARS);
                    }
                });
            } catch (IOException e) {
                LOGGER.debug("[{}-err] stream closed: {}", name, e.toString());
            }
        });
        tOut.setDaemon(true);
        tErr.setDaemon(true);
        tOut.start();
        tErr.start();

        boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            p.destroyForcibly();
            throw new ProcessTimeoutException(name + " timed out after " + timeout);
        }
        tOut.join(TimeUnit.SECONDS.toMillis(5));
        tErr.join(TimeUnit.SECONDS.toMillis(5));

        String stderr;
        synchronized (errBuf) {
            stderr = errBuf.toString();
        }
        return new Result(p.exitValue(), outBuf.toByteArray(), stderr);
    }

    /** Appends one line and drops the oldest characters so {@code buf} never exceeds {@code max}. */
    static void appendTail(StringBuilder buf, String line, int max) {
        buf.append(line).append('\n');
        int excess = buf.length() - max;
        if (excess > 0) {
            buf.delete(0, excess);
        }
    }
}
