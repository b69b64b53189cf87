package com.example.LusLaboris.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Queue message for the evaluation worker. Carries the full, untruncated
 * context and documents of one answered question.
 */
public record EvaluationTask(
        String sessionId,
        String question,
        String context,
        String answer,
        List<RetrievedDocument> documents,
        Map<String, Object> metadata,
        Instant timestamp
) {
    public EvaluationTask {
        documents = documents == null ? List.of() : List.copyOf(documents);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
