package com.example.LusLaboris.health;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.repository.LawArticleVectorRepository;
import com.example.LusLaboris.service.EmbeddingService;
import com.example.LusLaboris.service.RagGenerationService;
import com.example.LusLaboris.service.RerankingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Whether questions can be answered at all: the answering collection must
 * exist. The LLM itself is not called; provider and model are reported as
 * configured.
 */
@Component
public class RagHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(RagHealthIndicator.class);

    private final LawArticleVectorRepository vectorRepository;
    private final RagGenerationService generationService;
    private final EmbeddingService embeddingService;
    private final RerankingService rerankingService;
    private final String collectionName;

    public RagHealthIndicator(LawArticleVectorRepository vectorRepository, RagGenerationService generationService,
                              EmbeddingService embeddingService, RerankingService rerankingService,
                              RagProperties properties) {
        this.vectorRepository = vectorRepository;
        this.generationService = generationService;
        this.embeddingService = embeddingService;
        this.rerankingService = rerankingService;
        this.collectionName = properties.getRag().getCollectionName();
    }

    @Override
    public Health health() {
        try {
            if (!vectorRepository.collectionExists(collectionName)) {
                return Health.down()
                        .withDetail("error", "Collection " + collectionName + " does not exist")
                        .withDetail("collection", collectionName)
                        .build();
            }
            return Health.up()
                    .withDetail("provider", generationService.providerName())
                    .withDetail("model", generationService.modelName())
                    .withDetail("embedding_model", embeddingService.modelName())
                    .withDetail("collection", collectionName)
                    .withDetail("reranking_enabled", rerankingService.isEnabled())
                    .build();
        } catch (RuntimeException e) {
            log.error("RAG health check failed", e);
            return Health.down(e).withDetail("collection", collectionName).build();
        }
    }
}
