package com.example.ticketmatch.embedding;

import com.example.ticketmatch.config.MatcherProperties;
import com.example.ticketmatch.exception.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Calls an OpenAI-compatible /embeddings endpoint to turn ticket text into
 * vectors. Any server that speaks that protocol works (OpenAI, a local
 * text-embeddings-inference container serving all-MiniLM-L6-v2, Ollama...).
 * <p>
 * Single-text results are cached in Caffeine keyed by SHA-256 of the text.
 */
@Slf4j
@Component
public class OpenAiEmbeddingGateway implements EmbeddingGateway {

    private static final MediaType JSON_MEDIA = MediaType.get("application/json");

    private final MatcherProperties.EmbeddingConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    /** sha256(text) → vector */
    private final Cache<String, float[]> embeddingCache;

    public OpenAiEmbeddingGateway(MatcherProperties properties,
                                  OkHttpClient httpClient,
                                  ObjectMapper objectMapper) {
        this.config = properties.getEmbedding();
        this.httpClient = httpClient.newBuilder()
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        this.objectMapper = objectMapper;
        this.embeddingCache = Caffeine.newBuilder()
                .maximumSize(config.getCacheSize())
                .expireAfterWrite(1, TimeUnit.HOURS)
                .build();
    }

    // ── Public API ──

    /**
     * Returns a fresh array on every call; the cached copy is never handed out.
     */
    @Override
    public float[] embed(String text) {
        String hash = sha256(text);
        float[] cached = embeddingCache.getIfPresent(hash);
        if (cached != null) return cached.clone();

        float[] vector = callEmbeddingApi(List.of(text)).get(0);
        embeddingCache.put(hash, vector.clone());
        return vector;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) return List.of();

        int batchSize = Math.max(1, config.getBatchSize());
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> chunk = texts.subList(from, Math.min(from + batchSize, texts.size()));
            vectors.addAll(callEmbeddingApi(chunk));
            log.debug("Embedded {}/{} texts", vectors.size(), texts.size());
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return config.getDimension();
    }

    @Override
    public String modelName() {
        return config.getModel();
    }

    // ── API call ──

    private List<float[]> callEmbeddingApi(List<String> inputs) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getModel());
        ArrayNode inputArray = body.putArray("input");
        inputs.forEach(inputArray::add);

        Request.Builder builder = new Request.Builder()
                .url(stripTrailingSlash(config.getBaseUrl()) + "/embeddings")
                .addHeader("Content-Type", "application/json");
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.addHeader("Authorization", "Bearer " + config.getApiKey());
        }

        try {
            Request request = builder
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON_MEDIA))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    log.error("Embedding API error {}: {}", response.code(), responseBody);
                    throw new ProviderException("Embedding provider returned HTTP " + response.code());
                }
                return parseEmbeddingResponse(responseBody, inputs.size());
            }
        } catch (JsonProcessingException e) {
            throw new ProviderException("Malformed embedding response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            log.error("Embedding API call failed: {}", e.getMessage());
            throw new ProviderException("Embedding provider unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the {@code data[]} array of an embeddings response, placing each
     * vector at its {@code index} and checking count and dimension.
     */
    List<float[]> parseEmbeddingResponse(String responseBody, int expectedCount) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode dataArray = root == null ? null : root.get("data");
        if (dataArray == null || !dataArray.isArray() || dataArray.size() != expectedCount) {
            throw new ProviderException("Embedding provider returned "
                    + (dataArray == null ? "no data" : dataArray.size() + " vectors")
                    + ", expected " + expectedCount);
        }

        float[][] ordered = new float[expectedCount][];
        for (int i = 0; i < dataArray.size(); i++) {
            JsonNode item = dataArray.get(i);
            int position = item.has("index") ? item.get("index").asInt() : i;
            JsonNode embeddingArray = item.get("embedding");
            if (position < 0 || position >= expectedCount || embeddingArray == null || !embeddingArray.isArray()) {
                throw new ProviderException("Malformed embedding entry at position " + i);
            }
            if (embeddingArray.size() != config.getDimension()) {
                throw new ProviderException("Embedding dimension mismatch: expected "
                        + config.getDimension() + ", got " + embeddingArray.size());
            }
            float[] vector = new float[embeddingArray.size()];
            for (int j = 0; j < embeddingArray.size(); j++) {
                vector[j] = (float) embeddingArray.get(j).asDouble();
            }
            ordered[position] = vector;
        }

        List<float[]> vectors = new ArrayList<>(expectedCount);
        for (int i = 0; i < expectedCount; i++) {
            if (ordered[i] == null) {
                throw new ProviderException("Embedding provider skipped input " + i);
            }
            vectors.add(ordered[i]);
        }
        return vectors;
    }

    // ── Helpers ──

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
