package com.example.LusLaboris.service;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.llm.LlmGenerationException;
import com.example.LusLaboris.llm.LlmProvider;
import com.example.LusLaboris.model.RetrievedDocument;
import com.example.LusLaboris.monitoring.MonitoringService;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns retrieved articles into a grounded answer:
 * - formats the articles as numbered context blocks
 * - fills the Spanish grounding template
 * - calls the configured {@link LlmProvider} with retry and exponential backoff
 */
@Service
public class RagGenerationService {

    private static final Logger log = LoggerFactory.getLogger(RagGenerationService.class);

    public static final String NO_DOCUMENTS_ANSWER = "No relevant documents found to answer the question.";

    static final String MISSING_TEXT = "Texto no disponible";
    static final String MISSING_CHAPTER = "Descripción no disponible";
    static final String MISSING_NUMBER = "N/A";
    static final String EMPTY_CONTEXT = "No se encontraron documentos relevantes.";

    static final String PROMPT_TEMPLATE = """
            Eres un asistente especializado en derecho laboral paraguayo.
            Responde la pregunta del usuario basándote únicamente en el contexto proporcionado.

            CONTEXTO:
            {context}

            PREGUNTA: {query}

            INSTRUCCIONES:
            - Responde de manera clara y precisa
            - Basa tu respuesta únicamente en el contexto proporcionado
            - Si el contexto no contiene información suficiente, indícalo claramente
            - Cita los artículos específicos cuando sea relevante
            - Mantén un tono profesional y técnico apropiado para el ámbito legal

            RESPUESTA:""";

    private final LlmProvider llmProvider;
    private final MonitoringService monitoringService;
    private final Retry retry;

    public RagGenerationService(LlmProvider llmProvider, MonitoringService monitoringService, RagProperties properties) {
        this.llmProvider = llmProvider;
        this.monitoringService = monitoringService;
        this.retry = Retry.of("llm-generation", retryConfig(properties.getLlm().getRetry()));
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "LLM call to {} failed (attempt {}), retrying in {} ms: {}",
                llmProvider.provider(), event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(), String.valueOf(event.getLastThrowable())));
    }

    /**
     * Same policy for every exception type: {@code maxAttempts} calls,
     * waits of initial, initial * multiplier, ... capped at maxBackoff.
     */
    static RetryConfig retryConfig(RagProperties.Retry settings) {
        return RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(backoff(settings))
                .build();
    }

    static IntervalFunction backoff(RagProperties.Retry settings) {
        return IntervalFunction.ofExponentialBackoff(
                settings.getInitialBackoff().toMillis(),
                settings.getMultiplier(),
                settings.getMaxBackoff().toMillis());
    }

    Retry retry() {
        return retry;
    }

    public String providerName() {
        return llmProvider.provider();
    }

    public String modelName() {
        return llmProvider.model();
    }

    /**
     * @throws LlmGenerationException once every attempt has failed
     */
    public String generate(String query, List<RetrievedDocument> documents, String sessionId) {
        if (documents == null || documents.isEmpty()) {
            return NO_DOCUMENTS_ANSWER;
        }

        String context = buildContext(documents);
        String prompt = new PromptTemplate(PROMPT_TEMPLATE)
                .render(Map.of("context", context, "query", query));

        String response;
        try {
            response = retry.executeSupplier(() -> llmProvider.complete(prompt));
        } catch (RuntimeException e) {
            log.error("LLM generation failed after {} attempts with {}/{}",
                    retry.getRetryConfig().getMaxAttempts(), llmProvider.provider(), llmProvider.model(), e);
            throw new LlmGenerationException("Failed to generate response with "
                    + llmProvider.provider() + ": " + e.getMessage(), e);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("context_length", context.length());
        metadata.put("documents_count", documents.size());
        metadata.put("query", query);
        monitoringService.trackLlmCall(sessionId, llmProvider.provider(), llmProvider.model(), prompt, response, metadata);

        log.info("Generated response using {}/{}", llmProvider.provider(), llmProvider.model());
        return response;
    }

    /**
     * Format documents as numbered context blocks:
     *
     *   Documento 1:
     *   article text [Capítulo: description - Artículo número: 42]
     */
    public String buildContext(List<RetrievedDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return EMPTY_CONTEXT;
        }

        return IntStream.range(0, documents.size())
                .mapToObj(i -> {
                    RetrievedDocument doc = documents.get(i);
                    return "Documento " + (i + 1) + ":\n"
                            + doc.stringField(RetrievedDocument.ARTICLE_TEXT, MISSING_TEXT)
                            + " [Capítulo: " + doc.stringField(RetrievedDocument.CHAPTER_DESCRIPTION, MISSING_CHAPTER)
                            + " - Artículo número: " + doc.stringField(RetrievedDocument.ARTICLE_NUMBER, MISSING_NUMBER)
                            + "]";
                })
                .collect(Collectors.joining("\n"));
    }
}
