package com.example.LusLaboris.health;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.repository.LawArticleVectorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Connectivity of the pgvector store: up as long as the collection table can
 * be read, whether or not the answering collection has been loaded yet.
 */
@Component
public class VectorStoreHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreHealthIndicator.class);

    private final LawArticleVectorRepository vectorRepository;
    private final String collectionName;

    public VectorStoreHealthIndicator(LawArticleVectorRepository vectorRepository, RagProperties properties) {
        this.vectorRepository = vectorRepository;
        this.collectionName = properties.getRag().getCollectionName();
    }

    @Override
    public Health health() {
        try {
            List<String> collections = vectorRepository.listCollections();
            return Health.up()
                    .withDetail("status", "connected")
                    .withDetail("backend", "pgvector")
                    .withDetail("collections_count", collections.size())
                    .withDetail("collection", collectionName)
                    .withDetail("collection_exists", collections.contains(collectionName))
                    .build();
        } catch (RuntimeException e) {
            log.error("Vector store health check failed", e);
            return Health.down(e)
                    .withDetail("status", "disconnected")
                    .withDetail("backend", "pgvector")
                    .build();
        }
    }
}
