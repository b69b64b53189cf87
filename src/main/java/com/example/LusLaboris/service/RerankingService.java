package com.example.LusLaboris.service;

import com.example.LusLaboris.model.RetrievalResult;
import com.example.LusLaboris.model.RetrievedDocument;
import com.example.LusLaboris.rerank.Reranker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Second relevance pass over vector search candidates.
 *
 * A reranker failure never reaches the caller: every candidate comes back in
 * its vector search order with {@code reranking_applied=false} and the error
 * message in the metadata.
 */
@Service
@RequiredArgsConstructor
public class RerankingService {

    private static final Logger log = LoggerFactory.getLogger(RerankingService.class);

    private final Reranker reranker;

    public boolean isEnabled() {
        return reranker.isEnabled();
    }

    public String modelName() {
        return reranker.model();
    }

    public RetrievalResult rerank(String query, List<RetrievedDocument> documents, int topK) {
        if (!reranker.isEnabled() || documents == null || documents.isEmpty()) {
            return new RetrievalResult(documents, Map.of(RetrievalResult.RERANKING_APPLIED, false));
        }

        try {
            log.info("Reranking {} documents with model: {}", documents.size(), reranker.model());
            List<String> texts = documents.stream().map(RetrievedDocument::rerankText).toList();
            List<Double> scores = reranker.score(query, texts);

            List<RetrievedDocument> scored = new ArrayList<>(documents.size());
            for (int i = 0; i < documents.size(); i++) {
                scored.add(documents.get(i).withRerankScore(scores.get(i)));
            }

            List<RetrievedDocument> reranked = scored.stream()
                    .sorted(Comparator.comparingDouble(RetrievedDocument::rerankScore).reversed())
                    .limit(topK)
                    .toList();

            DoubleSummaryStatistics stats = scores.stream().mapToDouble(Double::doubleValue).summaryStatistics();
            Map<String, Object> range = new LinkedHashMap<>();
            range.put("min", stats.getMin());
            range.put("max", stats.getMax());
            range.put("mean", stats.getAverage());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(RetrievalResult.RERANKING_APPLIED, true);
            metadata.put("model_name", reranker.model());
            metadata.put("documents_reranked", documents.size());
            metadata.put("documents_returned", reranked.size());
            metadata.put("rerank_scores_range", range);

            log.info("Reranking completed: {} documents returned", reranked.size());
            return new RetrievalResult(reranked, metadata);
        } catch (RuntimeException e) {
            log.error("Failed to rerank documents, keeping vector search order", e);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(RetrievalResult.RERANKING_APPLIED, false);
            metadata.put("error", String.valueOf(e.getMessage()));
            return new RetrievalResult(documents, metadata);
        }
    }
}
