package com.example.summarizer_backend.engine;

import com.example.summarizer_backend.config.EmbeddingProperties;
import com.example.summarizer_backend.engine.Interfaces.EmbeddingModel;
import com.example.summarizer_backend.exception.EmbeddingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link EmbeddingModel} backed by a CLIP inference server.
 * <p>
 * Wire format: {@code POST /v1/embeddings} with {@code {"model": .., "images": [base64..]}} or
 * {@code {"model": .., "texts": [..]}}; the server answers {@code {"embeddings": [[..], ..]}} in input order.
 * The vector dimension is learned from the first response and every later response is checked against it.
 */
public class ClipServerEmbeddingModel implements EmbeddingModel {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipServerEmbeddingModel.class);
    private static final String DIMENSION_PROBE_TEXT = "a photo";

    private final WebClient client;
    private final String model;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final AtomicInteger dimension = new AtomicInteger();

    public ClipServerEmbeddingModel(WebClient client, EmbeddingProperties props) {
        this.client = client;
        this.model = props.getModel();
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        this.maxRetries = Math.max(0, props.getMaxRetries());
        this.retryBackoff = Duration.ofMillis(Math.max(1, props.getRetryBackoffMillis()));
    }

    @Override
    public List<float[]> embedImages(List<byte[]> images) {
        if (images.isEmpty()) return List.of();
        Base64.Encoder enc = Base64.getEncoder();
        List<String> encoded = new ArrayList<>(images.size());
        for (byte[] img : images) encoded.add(enc.encodeToString(img));
        return request("images", encoded);
    }

    @Override
    public List<float[]> embedTexts(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        return request("texts", texts);
    }

    @Override
    public int dimension() {
        int d = dimension.get();
        if (d == 0) {
            embedTexts(List.of(DIMENSION_PROBE_TEXT));
            d = dimension.get();
        }
        return d;
    }

    private List<float[]> request(String field, List<String> inputs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put(field, inputs);

        long start = System.currentTimeMillis();
        JsonNode root = client.post()
                .uri("/v1/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::is5xxServerError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(b -> new ServerUnavailableException("embedding server " + resp.statusCode() + ": " + b)))
                .onStatus(HttpStatusCode::is4xxClientError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(b -> new EmbeddingException("embedding server rejected request " + resp.statusCode() + ": " + b)))
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                        .filter(ClipServerEmbeddingModel::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("EMBED retry attempt={} kind={} type={} message={}",
                                signal.totalRetriesInARow() + 1, field,
                                signal.failure().getClass().getSimpleName(), signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(t -> !(t instanceof EmbeddingException),
                        t -> new EmbeddingException("embedding request failed: " + t.getMessage(), t))
                .switchIfEmpty(Mono.error(new EmbeddingException("empty response from embedding server")))
                .block();

        List<float[]> vectors = parse(root, inputs.size());
        LOGGER.debug("EMBED kind={} n={} dim={} in={}ms", field, vectors.size(), dimension.get(),
                System.currentTimeMillis() - start);
        return vectors;
    }

    private List<float[]> parse(JsonNode root, int expected) {
        JsonNode arr = root == null ? null : root.get("embeddings");
        if (arr == null || !arr.isArray()) {
            throw new EmbeddingException("embedding response has no 'embeddings' array");
        }
        if (arr.size() != expected) {
            throw new EmbeddingException("embedding server returned " + arr.size() + " vectors for " + expected + " inputs");
        }
        List<float[]> out = new ArrayList<>(expected);
        for (JsonNode vec : arr) {
            float[] v = new float[vec.size()];
            for (int i = 0; i < v.length; i++) v[i] = (float) vec.get(i).asDouble();
            pinDimension(v.length);
            out.add(v);
        }
        return out;
    }

    private void pinDimension(int length) {
        if (length == 0) {
            throw new EmbeddingException("embedding server returned an empty vector");
        }
        if (dimension.compareAndSet(0, length)) {
            LOGGER.info("EMBED model={} dimension={}", model, length);
            return;
        }
        if (dimension.get() != length) {
            throw new EmbeddingException("embedding dimension changed from " + dimension.get() + " to " + length);
        }
    }

    private static boolean isRetryable(Throwable t) {
        Throwable cursor = t;
        while (cursor != null) {
            if (cursor instanceof ServerUnavailableException
                    || cursor instanceof PrematureCloseException
                    || cursor instanceof WebClientRequestException
                    || cursor instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private static class ServerUnavailableException extends RuntimeException {
        ServerUnavailableException(String message) {
            super(message);
        }
    }
}
