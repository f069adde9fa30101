package com.example.ticketmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the ticket matcher.
 * Maps to the 'ticket-matcher' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ticket-matcher")
public class MatcherProperties {

    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexConfig index = new IndexConfig();
    private CorpusConfig corpus = new CorpusConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private GenerationConfig generation = new GenerationConfig();
    private BootstrapConfig bootstrap = new BootstrapConfig();

    @Data
    public static class EmbeddingConfig {
        /** Base URL of an OpenAI-compatible embeddings API */
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "sentence-transformers/all-MiniLM-L6-v2";
        private String apiKey = "";
        private int dimension = 384;
        private int batchSize = 64;
        private int timeoutSeconds = 30;
        private int cacheSize = 2000;
    }

    @Data
    public static class IndexConfig {
        private String path = "data/ticket_index.bin";
        /** Defaults to {@code <path>.slots.json} when blank */
        private String slotTablePath = "";
        private int m = 16;
        private int efConstruction = 200;
        private int ef = 50;

        public String resolvedSlotTablePath() {
            return slotTablePath == null || slotTablePath.isBlank() ? path + ".slots.json" : slotTablePath;
        }
    }

    @Data
    public static class CorpusConfig {
        private String path = "data/combined_data.csv";
    }

    @Data
    public static class RetrievalConfig {
        private int defaultK = 3;
        private double defaultThreshold = 0.5;
    }

    @Data
    public static class GenerationConfig {
        private String baseUrl = "https://api-inference.huggingface.co/v1";
        private String model = "mistralai/Mixtral-8x7B-Instruct-v0.1";
        private String apiKey = "";
        private double temperature = 0.3;
        private double topP = 0.95;
        private int maxTokens = 1024;
        private int timeoutSeconds = 120;
        private String signOff = "Best, your Smart assistant";
    }

    @Data
    public static class BootstrapConfig {
        private boolean enabled = true;
        private Mode mode = Mode.AUTO;

        public enum Mode {
            /** Load when the index file exists, otherwise build */
            AUTO,
            BUILD,
            LOAD
        }
    }
}
