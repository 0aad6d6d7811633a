package com.example.summarizer_backend.engine.Interfaces;

import java.util.List;

/**
 * Handle on a loaded joint image/text embedding model. One instance is shared by every job in the
 * process; implementations must be safe to call from several worker threads and must not keep
 * per-request state.
 */
public interface EmbeddingModel {

    /**
     * Embeds encoded images. Output order matches input order.
     */
    List<float[]> embedImages(List<byte[]> images);

    /**
     * Embeds text queries into the same space as {@link #embedImages(List)}.
     */
    List<float[]> embedTexts(List<String> texts);

    /**
     * Vector dimension. Every vector returned by this model has exactly this length.
     */
    int dimension();
}
