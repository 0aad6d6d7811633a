package com.example.summarizer_backend.sampler;

import com.example.summarizer_backend.dto.Frame;
import com.example.summarizer_backend.engine.Interfaces.FrameDecoder;
import com.example.summarizer_backend.exception.ResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, finite sequence of frames at {@code 0, stride, 2*stride, ..} below the source duration.
 * Nothing is decoded until iteration; every {@link #iterator()} call starts again from the beginning.
 * <p>
 * Frames that fail to decode are skipped with a warning. If not a single frame of a pass decodes, the
 * iterator throws {@link ResourceException} instead of ending silently.
 */
public class FrameSequence implements Iterable<Frame> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameSequence.class);

    private final FrameDecoder decoder;
    private final Path file;
    private final long durationMs;
    private final SamplingStride stride;
    private final int frameWidth;

    FrameSequence(FrameDecoder decoder, Path file, long durationMs, SamplingStride stride, int frameWidth) {
        this.decoder = decoder;
        this.file = file;
        this.durationMs = durationMs;
        this.stride = stride;
        this.frameWidth = frameWidth;
    }

    public SamplingStride stride() {
        return stride;
    }

    public long durationMs() {
        return durationMs;
    }

    /** Upper bound on the number of frames a pass yields. */
    public long expectedCount() {
        return stride.sampleCount(durationMs);
    }

    @Override
    public Iterator<Frame> iterator() {
        return new Iterator<>() {
            private long nextTs = 0L;
            private Frame pending;
            private int decoded;
            private int skipped;

            @Override
            public boolean hasNext() {
                while (pending == null && nextTs < durationMs) {
                    long ts = nextTs;
                    nextTs += stride.strideMs();
                    try {
                        pending = new Frame(ts, decoder.decodeAt(file, ts, frameWidth));
                        decoded++;
                    } catch (IOException e) {
                        skipped++;
                        LOGGER.warn("SAMPLE skip file={} ts={}ms reason={}", file.getFileName(), ts, e.getMessage());
                    }
                }
                if (pending == null && decoded == 0 && skipped > 0) {
                    throw new ResourceException("Source video is undecodable: none of " + skipped
                            + " sampled frames could be read from " + file.getFileName());
                }
                return pending != null;
            }

            @Override
            public Frame next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Frame f = pending;
                pending = null;
                return f;
            }
        };
    }
}
