package com.example.ticketmatch.embedding;

import com.example.ticketmatch.config.MatcherProperties;
import com.example.ticketmatch.exception.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiEmbeddingGatewayTest {

    private OpenAiEmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        MatcherProperties properties = new MatcherProperties();
        properties.getEmbedding().setDimension(3);
        properties.getEmbedding().setBaseUrl("http://127.0.0.1:1/v1");
        properties.getEmbedding().setTimeoutSeconds(2);
        gateway = new OpenAiEmbeddingGateway(properties, new OkHttpClient(), new ObjectMapper());
    }

    @Test
    void placesVectorsByResponseIndex() throws Exception {
        String body = """
                {"data": [
                  {"index": 1, "embedding": [0.4, 0.5, 0.6]},
                  {"index": 0, "embedding": [0.1, 0.2, 0.3]}
                ]}
                """;

        List<float[]> vectors = gateway.parseEmbeddingResponse(body, 2);

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(0.1f, 0.2f, 0.3f);
        assertThat(vectors.get(1)).containsExactly(0.4f, 0.5f, 0.6f);
    }

    @Test
    void rejectsDimensionMismatch() {
        String body = "{\"data\": [{\"index\": 0, \"embedding\": [0.1, 0.2]}]}";

        assertThatThrownBy(() -> gateway.parseEmbeddingResponse(body, 1))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("dimension mismatch");
    }

    @Test
    void rejectsWrongVectorCount() {
        String body = "{\"data\": [{\"index\": 0, \"embedding\": [0.1, 0.2, 0.3]}]}";

        assertThatThrownBy(() -> gateway.parseEmbeddingResponse(body, 2))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    void rejectsResponseWithoutData() {
        assertThatThrownBy(() -> gateway.parseEmbeddingResponse("{\"error\": \"overloaded\"}", 1))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    void unreachableProviderSurfacesAsProviderException() {
        assertThatThrownBy(() -> gateway.embed("Printer offline"))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    void emptyBatchDoesNotCallProvider() {
        assertThat(gateway.embedBatch(List.of())).isEmpty();
    }

    @Test
    void exposesConfiguredDimensionAndModel() {
        assertThat(gateway.dimension()).isEqualTo(3);
        assertThat(gateway.modelName()).isEqualTo("sentence-transformers/all-MiniLM-L6-v2");
    }

    @Test
    void cachedVectorCannotBeCorruptedByCallers() {
        AtomicInteger calls = new AtomicInteger();
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    calls.incrementAndGet();
                    return new Response.Builder()
                            .request(chain.request())
                            .protocol(Protocol.HTTP_1_1)
                            .code(200)
                            .message("OK")
                            .body(ResponseBody.create("{\"data\": [{\"index\": 0, \"embedding\": [0.1, 0.2, 0.3]}]}",
                                    MediaType.get("application/json")))
                            .build();
                })
                .build();
        MatcherProperties properties = new MatcherProperties();
        properties.getEmbedding().setDimension(3);
        OpenAiEmbeddingGateway cachingGateway = new OpenAiEmbeddingGateway(properties, client, new ObjectMapper());

        float[] first = cachingGateway.embed("printer offline");
        first[0] = 42f;
        float[] second = cachingGateway.embed("printer offline");
        second[1] = 42f;
        float[] third = cachingGateway.embed("printer offline");

        assertThat(calls).hasValue(1);
        assertThat(third).containsExactly(0.1f, 0.2f, 0.3f);
    }
}
