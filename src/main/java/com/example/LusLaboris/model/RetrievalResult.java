package com.example.LusLaboris.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the retrieval stage:
 * - documents: relevance-ordered articles (best match first)
 * - metadata: reranking details ("reranking_applied", score range, error)
 */
public record RetrievalResult(
        List<RetrievedDocument> documents,
        Map<String, Object> metadata
) {
    public static final String RERANKING_APPLIED = "reranking_applied";

    public RetrievalResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean rerankingApplied() {
        return Boolean.TRUE.equals(metadata.get(RERANKING_APPLIED));
    }
}
