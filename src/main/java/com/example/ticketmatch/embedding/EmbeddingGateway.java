package com.example.ticketmatch.embedding;

import java.util.List;

/**
 * Maps normalized ticket text to fixed-dimension vectors.
 * Implementations throw {@link com.example.ticketmatch.exception.ProviderException}
 * when the provider is unreachable or returns a vector of the wrong dimension,
 * and never retry on their own.
 */
public interface EmbeddingGateway {

    float[] embed(String text);

    /**
     * Embeds many texts at once; the result is parallel to {@code texts}.
     */
    List<float[]> embedBatch(List<String> texts);

    int dimension();

    String modelName();
}
