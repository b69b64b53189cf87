package com.example.LusLaboris.health;

import com.example.LusLaboris.rerank.Reranker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scores one fixed pair against the cross-encoder endpoint. A disabled
 * reranker is reported as up, since retrieval works without it.
 */
@Component
@RequiredArgsConstructor
public class RerankerHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(RerankerHealthIndicator.class);

    static final String CHECK_TEXT = "health-check";

    private final Reranker reranker;

    @Override
    public Health health() {
        if (!reranker.isEnabled()) {
            return Health.up()
                    .withDetail("status", "disabled")
                    .withDetail("enabled", false)
                    .build();
        }

        try {
            List<Double> scores = reranker.score(CHECK_TEXT, List.of(CHECK_TEXT));
            Double score = scores.size() == 1 ? scores.get(0) : null;
            if (score == null || !Double.isFinite(score)) {
                return Health.down()
                        .withDetail("enabled", true)
                        .withDetail("model", reranker.model())
                        .withDetail("error", "Unusable score for a fixed pair: " + scores)
                        .build();
            }
            return Health.up()
                    .withDetail("enabled", true)
                    .withDetail("model", reranker.model())
                    .withDetail("score.same", score)
                    .build();
        } catch (RuntimeException e) {
            log.error("Reranker health check failed", e);
            return Health.down(e)
                    .withDetail("enabled", true)
                    .withDetail("model", reranker.model())
                    .build();
        }
    }
}
