package com.example.LusLaboris.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Application settings bound from the {@code lus-laboris.*} namespace.
 * Every value has a default so the service boots with an empty config;
 * secrets (API keys, DB password) live under the Spring AI / datasource keys.
 */
@Data
@ConfigurationProperties(prefix = "lus-laboris")
public class RagProperties {

    private final Rag rag = new Rag();
    private final Llm llm = new Llm();
    private final Embedding embedding = new Embedding();
    private final Reranking reranking = new Reranking();
    private final Evaluation evaluation = new Evaluation();
    private final Monitoring monitoring = new Monitoring();
    private final Jobs jobs = new Jobs();
    private final Ingestion ingestion = new Ingestion();

    @Data
    public static class Rag {
        /** Number of documents handed to the LLM. */
        private int topK = 5;
        private String collectionName = "labor_law_articles";
        /** Characters of article text kept in API document previews. */
        private int previewLength = 200;
        private Duration embeddingTimeout = Duration.ofSeconds(30);
        private Duration searchTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Llm {
        /** One of "openai" or "deepseek"; resolved once at startup. */
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private int maxTokens = 1500;
        private Duration timeout = Duration.ofSeconds(60);
        private final Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(60);
    }

    @Data
    public static class Embedding {
        private String model = "text-embedding-3-small";
        private int batchSize = 100;
    }

    @Data
    public static class Reranking {
        private boolean enabled = false;
        private String model = "BAAI/bge-reranker-base";
        private String url = "http://localhost:8081";
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Evaluation {
        private boolean enabled = true;
        private String model = "gpt-4o-mini";
        private int queueCapacity = 1000;
        private Duration checkTimeout = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Monitoring {
        private boolean enabled = true;
        private String projectName = "lus-laboris-api";
        private String serviceVersion = "1.0.0";
    }

    @Data
    public static class Jobs {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
        /** Finished jobs older than this are pruned from the job table. */
        private Duration retention = Duration.ofHours(24);
    }

    @Data
    public static class Ingestion {
        /** Base directory for local ingestion files. */
        private String localDataPath = "data/processed";
    }
}
