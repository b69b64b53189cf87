package com.example.LusLaboris.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one vector store load, stored as the job result.
 */
public record LoadResult(
        String collectionName,
        int documentsProcessed,
        int documentsInserted,
        double processingTimeSeconds,
        String embeddingModelUsed,
        int vectorDimensions,
        int batchSize
) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("collection_name", collectionName);
        map.put("documents_processed", documentsProcessed);
        map.put("documents_inserted", documentsInserted);
        map.put("processing_time_seconds", processingTimeSeconds);
        map.put("embedding_model_used", embeddingModelUsed);
        map.put("vector_dimensions", vectorDimensions);
        map.put("batch_size", batchSize);
        return map;
    }
}
