package com.example.summarizer_backend.embedding;

import com.example.summarizer_backend.dto.Frame;
import com.example.summarizer_backend.dto.FrameSample;
import com.example.summarizer_backend.dto.ScoredFrame;
import com.example.summarizer_backend.engine.Interfaces.EmbeddingModel;
import com.example.summarizer_backend.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps frames and text queries into the model's shared vector space and scores them against each other.
 * All vectors leaving this class are L2-normalized, so similarity is a dot product.
 */
public class EmbeddingEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingEngine.class);

    private final EmbeddingModel model;
    private final int batchSize;

    public EmbeddingEngine(EmbeddingModel model, int batchSize) {
        this.model = model;
        this.batchSize = Math.max(1, batchSize);
    }

    public List<FrameSample> embedFrames(Iterable<Frame> frames) {
        return embedFrames(frames, () -> { });
    }

    /**
     * Embeds frames in batches of the configured size.
     *
     * @param beforeBatch invoked before every model call; may throw to abort (cancellation).
     */
    public List<FrameSample> embedFrames(Iterable<Frame> frames, Runnable beforeBatch) {
        List<FrameSample> out = new ArrayList<>();
        List<Frame> batch = new ArrayList<>(batchSize);
        for (Frame f : frames) {
            batch.add(f);
            if (batch.size() == batchSize) {
                flush(batch, out, beforeBatch);
            }
        }
        if (!batch.isEmpty()) {
            flush(batch, out, beforeBatch);
        }
        LOGGER.info("EMBED frames={} batchSize={}", out.size(), batchSize);
        return out;
    }

    private void flush(List<Frame> batch, List<FrameSample> out, Runnable beforeBatch) {
        beforeBatch.run();
        List<byte[]> images = new ArrayList<>(batch.size());
        for (Frame f : batch) images.add(f.image());
        List<float[]> vectors = model.embedImages(images);
        if (vectors.size() != batch.size()) {
            throw new EmbeddingException("model returned " + vectors.size() + " vectors for " + batch.size() + " frames");
        }
        for (int i = 0; i < batch.size(); i++) {
            out.add(new FrameSample(batch.get(i).timestampMs(), normalize(vectors.get(i))));
        }
        batch.clear();
    }

    public float[] embedText(String query) {
        List<float[]> v = model.embedTexts(List.of(query));
        if (v.size() != 1) {
            throw new EmbeddingException("model returned " + v.size() + " vectors for one query");
        }
        return normalize(v.get(0));
    }

    /**
     * Embeds several phrasings of one query and averages them into a single normalized vector.
     */
    public float[] embedPrompts(List<String> prompts) {
        if (prompts.isEmpty()) {
            throw new IllegalArgumentException("prompts must not be empty");
        }
        List<float[]> vectors = model.embedTexts(prompts);
        if (vectors.size() != prompts.size()) {
            throw new EmbeddingException("model returned " + vectors.size() + " vectors for " + prompts.size() + " prompts");
        }
        float[] sum = new float[vectors.get(0).length];
        for (float[] v : vectors) {
            float[] n = normalize(v);
            requireSameDimension(sum, n);
            for (int i = 0; i < sum.length; i++) sum[i] += n[i];
        }
        return normalize(sum);
    }

    public List<ScoredFrame> score(List<FrameSample> samples, float[] query) {
        List<ScoredFrame> out = new ArrayList<>(samples.size());
        for (FrameSample s : samples) {
            out.add(new ScoredFrame(s.timestampMs(), similarity(s.embedding(), query)));
        }
        return out;
    }

    /**
     * Cosine similarity with negatives clamped to zero, so the result lies in {@code [0, 1]}.
     */
    public static double similarity(float[] a, float[] b) {
        requireSameDimension(a, b);
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        double cos = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Math.max(0.0, Math.min(1.0, cos));
    }

    static float[] normalize(float[] v) {
        double norm = 0;
        for (float x : v) norm += (double) x * x;
        norm = Math.sqrt(norm);
        float[] out = new float[v.length];
        if (norm == 0) return out;
        for (int i = 0; i < v.length; i++) out[i] = (float) (v[i] / norm);
        return out;
    }

    private static void requireSameDimension(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new EmbeddingException("dimension mismatch: " + a.length + " vs " + b.length);
        }
    }
}
