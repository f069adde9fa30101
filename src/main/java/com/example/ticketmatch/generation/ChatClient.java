package com.example.ticketmatch.generation;

import com.example.ticketmatch.config.MatcherProperties;
import com.example.ticketmatch.exception.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client for OpenAI-compatible chat completion endpoints (OpenAI, Hugging Face
 * inference router, vLLM, Ollama...). Failures surface as {@link ProviderException};
 * retrying is left to the caller.
 */
@Slf4j
@Component
public class ChatClient {

    private static final MediaType JSON = MediaType.get("application/json");

    private final MatcherProperties.GenerationConfig config;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public ChatClient(MatcherProperties properties, ObjectMapper objectMapper, OkHttpClient httpClient) {
        this.config = properties.getGeneration();
        this.objectMapper = objectMapper;
        this.httpClient = httpClient.newBuilder()
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    /**
     * Sends the conversation and returns the content of the first choice.
     */
    public String chat(List<ChatMessage> messages, ChatOptions options) {
        try {
            String requestBody = buildRequestBody(messages, options);
            log.debug("Chat request with {} messages (max_tokens={})", messages.size(), options.maxTokens());

            Request.Builder builder = new Request.Builder()
                    .url(getApiUrl())
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(requestBody, JSON));
            if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
                builder.addHeader("Authorization", "Bearer " + config.getApiKey());
            }

            try (Response response = httpClient.newCall(builder.build()).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    log.error("Chat API error: {} - {}", response.code(), responseBody);
                    throw new ProviderException("Generation provider returned HTTP " + response.code());
                }
                return parseResponse(responseBody);
            }
        } catch (JsonProcessingException e) {
            throw new ProviderException("Malformed generation response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            log.error("Failed to communicate with generation provider", e);
            throw new ProviderException("Generation provider unreachable: " + e.getMessage(), e);
        }
    }

    private String getApiUrl() {
        String base = config.getBaseUrl();
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/chat/completions";
    }

    String buildRequestBody(List<ChatMessage> messages, ChatOptions options) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("temperature", options.temperature());
        root.put("top_p", options.topP());
        root.put("max_tokens", options.maxTokens());

        ArrayNode messagesArray = root.putArray("messages");
        for (ChatMessage msg : messages) {
            ObjectNode msgNode = messagesArray.addObject();
            msgNode.put("role", msg.getRole().name().toLowerCase());
            msgNode.put("content", msg.getContent());
        }
        return objectMapper.writeValueAsString(root);
    }

    String parseResponse(String responseBody) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode choices = root == null ? null : root.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ProviderException("Generation provider returned no choices");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new ProviderException("Generation provider returned an empty message");
        }
        return content.asText();
    }
}
