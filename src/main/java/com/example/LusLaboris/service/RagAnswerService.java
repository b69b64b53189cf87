package com.example.LusLaboris.service;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.model.AnswerResult;
import com.example.LusLaboris.model.DocumentPreview;
import com.example.LusLaboris.model.EvaluationTask;
import com.example.LusLaboris.model.RetrievalResult;
import com.example.LusLaboris.model.RetrievedDocument;
import com.example.LusLaboris.monitoring.MonitoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-shot RAG answer:
 * - Retrieve related articles (optionally reranked)
 * - Generate a grounded answer
 * - Hand the full exchange to the evaluation worker without waiting for it
 *
 * Failures come back as {@code success=false} results; nothing is thrown.
 */
@Service
public class RagAnswerService {

    private static final Logger log = LoggerFactory.getLogger(RagAnswerService.class);

    private final RagRetrievalService retrievalService;
    private final RagGenerationService generationService;
    private final EvaluationService evaluationService;
    private final MonitoringService monitoringService;
    private final int previewLength;

    public RagAnswerService(RagRetrievalService retrievalService,
                            RagGenerationService generationService,
                            EvaluationService evaluationService,
                            MonitoringService monitoringService,
                            RagProperties properties) {
        this.retrievalService = retrievalService;
        this.generationService = generationService;
        this.evaluationService = evaluationService;
        this.monitoringService = monitoringService;
        this.previewLength = properties.getRag().getPreviewLength();
    }

    public AnswerResult answer(String question) {
        return answer(question, null);
    }

    /**
     * @param sessionId caller-owned monitoring session, or null to let this call
     *                  open one and end it before returning
     */
    public AnswerResult answer(String question, String sessionId) {
        long start = System.nanoTime();
        boolean ownsSession = sessionId == null;
        String session = ownsSession ? monitoringService.createSession() : sessionId;

        try {
            RetrievalResult retrieval = retrievalService.retrieve(question, session);
            List<RetrievedDocument> documents = retrieval.documents();

            String answer = generationService.generate(question, documents, session);
            double processingTime = secondsSince(start);

            enqueueEvaluation(session, question, answer, retrieval, processingTime);

            AnswerResult result = AnswerResult.builder()
                    .success(true)
                    .question(question)
                    .answer(answer)
                    .processingTimeSeconds(round3(processingTime))
                    .documentsRetrieved(documents.size())
                    .topK(retrievalService.topK())
                    .rerankingApplied(retrieval.rerankingApplied())
                    .documents(documents.stream().map(doc -> DocumentPreview.of(doc, previewLength)).toList())
                    .sessionId(session)
                    .build();

            log.info("Question answered successfully in {}s for session {}",
                    String.format("%.3f", processingTime), session);
            return result;
        } catch (RuntimeException e) {
            double processingTime = secondsSince(start);
            log.error("Failed to answer question for session {}", session, e);
            return AnswerResult.failed(question, String.valueOf(e.getMessage()), round3(processingTime), session);
        } finally {
            if (ownsSession) {
                monitoringService.endSession(session);
            }
        }
    }

    private void enqueueEvaluation(String sessionId, String question, String answer,
                                   RetrievalResult retrieval, double processingTime) {
        try {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("processing_time", processingTime);
            metadata.put("llm_provider", generationService.providerName());
            metadata.put("llm_model", generationService.modelName());
            metadata.put("reranking_applied", retrieval.rerankingApplied());
            metadata.put("top_k", retrievalService.topK());

            evaluationService.enqueue(new EvaluationTask(
                    sessionId,
                    question,
                    generationService.buildContext(retrieval.documents()),
                    answer,
                    retrieval.documents(),
                    metadata,
                    Instant.now()
            ));
            log.debug("Evaluation enqueued for asynchronous processing (session {})", sessionId);
        } catch (RuntimeException e) {
            // the answer is already produced; a lost evaluation must not fail it
            log.warn("Failed to enqueue evaluation for session {}", sessionId, e);
        }
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static double round3(double value) {
        return Math.round(value * 1000d) / 1000d;
    }
}
