package com.example.LusLaboris.service;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.exception.RetrievalException;
import com.example.LusLaboris.model.RetrievalResult;
import com.example.LusLaboris.model.RetrievedDocument;
import com.example.LusLaboris.monitoring.MonitoringService;
import com.example.LusLaboris.repository.LawArticleVectorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * RAG retrieval-only service:
 * - Embeds the question
 * - Queries the vector store (twice the candidates when reranking)
 * - Optionally reranks and cuts back to topK
 *
 * This service does NOT call any chat/LLM APIs.
 */
@Service
public class RagRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RagRetrievalService.class);

    private final EmbeddingService embeddingService;
    private final LawArticleVectorRepository vectorRepository;
    private final RerankingService rerankingService;
    private final MonitoringService monitoringService;
    private final RagProperties.Rag settings;

    public RagRetrievalService(EmbeddingService embeddingService,
                               LawArticleVectorRepository vectorRepository,
                               RerankingService rerankingService,
                               MonitoringService monitoringService,
                               RagProperties properties) {
        this.embeddingService = embeddingService;
        this.vectorRepository = vectorRepository;
        this.rerankingService = rerankingService;
        this.monitoringService = monitoringService;
        this.settings = properties.getRag();
    }

    public int topK() {
        return settings.getTopK();
    }

    /**
     * @throws RetrievalException when embedding or search fails or times out
     */
    public RetrievalResult retrieve(String query, String sessionId) {
        int topK = settings.getTopK();
        boolean rerank = rerankingService.isEnabled();

        try {
            long start = System.nanoTime();
            float[] queryVector = blocking(() -> embeddingService.embed(query), settings.getEmbeddingTimeout());
            monitoringService.trackEmbeddingGeneration(sessionId, query, embeddingService.modelName(), secondsSince(start));

            int limit = rerank ? topK * 2 : topK;
            start = System.nanoTime();
            List<RetrievedDocument> candidates = blocking(
                    () -> vectorRepository.search(settings.getCollectionName(), queryVector, limit),
                    settings.getSearchTimeout());
            monitoringService.trackVectorstoreSearch(sessionId, query, candidates.size(), secondsSince(start));
            log.debug("Vector search returned {} candidates (limit {})", candidates.size(), limit);

            if (!rerank || candidates.isEmpty()) {
                return new RetrievalResult(candidates, Map.of(RetrievalResult.RERANKING_APPLIED, false));
            }

            start = System.nanoTime();
            RetrievalResult reranked = rerankingService.rerank(query, candidates, topK);
            monitoringService.trackReranking(sessionId, query, candidates.size(), secondsSince(start), reranked.metadata());
            return reranked;
        } catch (RuntimeException e) {
            log.error("Failed to retrieve documents for session {}", sessionId, e);
            throw new RetrievalException("Failed to retrieve documents: " + describe(e), e);
        }
    }

    // Embedding and search block on network IO; run them on boundedElastic so the timeout can fire
    private static <T> T blocking(Callable<T> call, Duration timeout) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .block();
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
