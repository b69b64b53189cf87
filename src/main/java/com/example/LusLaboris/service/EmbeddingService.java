package com.example.LusLaboris.service;

import com.example.LusLaboris.config.RagProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper over the Spring AI {@link EmbeddingModel} that batches bulk
 * requests and exposes the configured model name for tracing.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int batchSize;

    public EmbeddingService(EmbeddingModel embeddingModel, RagProperties properties) {
        this.embeddingModel = embeddingModel;
        this.modelName = properties.getEmbedding().getModel();
        this.batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
    }

    public float[] embed(String text) {
        return embeddingModel.embed(text);
    }

    public List<float[]> embedAll(List<String> texts) {
        return embedAll(texts, batchSize);
    }

    public List<float[]> embedAll(List<String> texts, int batchSize) {
        int size = Math.max(1, batchSize);
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += size) {
            List<String> batch = texts.subList(start, Math.min(start + size, texts.size()));
            embeddings.addAll(embeddingModel.embed(batch));
            log.debug("Embedded batch {}-{} of {}", start, start + batch.size(), texts.size());
        }
        return embeddings;
    }

    /**
     * Vector size of the configured model. May cost one embedding call the
     * first time when the model's dimensions are not known up front.
     */
    public int dimensions() {
        return embeddingModel.dimensions();
    }

    public String modelName() {
        return modelName;
    }
}
