package com.example.LusLaboris.health;

import com.example.LusLaboris.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmbeddingHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingHealthIndicator.class);

    private final EmbeddingService embeddingService;

    @Override
    public Health health() {
        try {
            int dimensions = embeddingService.dimensions();
            if (dimensions <= 0) {
                return Health.down()
                        .withDetail("model", embeddingService.modelName())
                        .withDetail("error", "Embedding model reported no dimensions")
                        .build();
            }
            return Health.up()
                    .withDetail("model", embeddingService.modelName())
                    .withDetail("dimensions", dimensions)
                    .build();
        } catch (RuntimeException e) {
            log.error("Embedding health check failed", e);
            return Health.down(e)
                    .withDetail("model", embeddingService.modelName())
                    .build();
        }
    }
}
