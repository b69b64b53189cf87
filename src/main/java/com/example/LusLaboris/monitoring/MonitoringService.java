package com.example.LusLaboris.monitoring;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.util.TraceAttributes;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Session tracker for request correlation:
 * - creates and ends monitoring sessions
 * - records actions and LLM calls per session
 * - emits one trace span per tracked operation
 *
 * Tracking methods never throw into the caller: unknown sessions are ignored
 * and sink failures are logged.
 */
@Service
public class MonitoringService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

    private final Map<String, MonitoringSession> sessions = new ConcurrentHashMap<>();
    private final MonitoringSink sink;
    private final boolean enabled;
    private final String serviceName;
    private final String serviceVersion;

    public MonitoringService(MonitoringSink sink, RagProperties properties) {
        this.sink = sink;
        this.enabled = properties.getMonitoring().isEnabled();
        this.serviceName = properties.getMonitoring().getProjectName();
        this.serviceVersion = properties.getMonitoring().getServiceVersion();
        if (!enabled) {
            log.info("Trace emission disabled by configuration; sessions are still tracked");
        }
    }

    public String createSession() {
        return createSession(null);
    }

    public String createSession(String userId) {
        String sessionId = UUID.randomUUID().toString();
        sessions.put(sessionId, new MonitoringSession(sessionId, userId, Instant.now()));
        log.debug("Created monitoring session {}", sessionId);
        return sessionId;
    }

    /**
     * End a session and compute its final metrics. The session is evicted;
     * a second call for the same id returns {@link SessionSummary#empty()}.
     */
    public SessionSummary endSession(String sessionId) {
        MonitoringSession session = sessionId == null ? null : sessions.remove(sessionId);
        if (session == null) {
            log.warn("Session {} not found", sessionId);
            return SessionSummary.empty();
        }

        Instant endTime = Instant.now();
        double duration = Duration.between(session.getStartTime(), endTime).toMillis() / 1000.0;
        SessionSummary summary = summarize(session, endTime, duration);

        log.info("Session {} ended. Duration: {}s, actions: {}, llm calls: {}",
                sessionId, String.format("%.2f", duration), summary.totalActions(), summary.llmCallsCount());
        return summary;
    }

    public void trackEmbeddingGeneration(String sessionId, String text, String model, double generationTime) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("embedding.model", model);
        attributes.put("embedding.text_length", text == null ? 0 : text.length());
        attributes.put("embedding.generation_time", generationTime);

        track(sessionId, "embedding_generation", "embedding_generation", SpanKind.CLIENT, attributes,
                Map.of("model", String.valueOf(model), "generation_time", generationTime));
    }

    public void trackVectorstoreSearch(String sessionId, String query, int resultsCount, double searchTime) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("vectorstore.query_length", query == null ? 0 : query.length());
        attributes.put("vectorstore.results_count", resultsCount);
        attributes.put("vectorstore.search_time", searchTime);

        track(sessionId, "vectorstore_search", "vectorstore_search", SpanKind.CLIENT, attributes,
                Map.of("results_count", resultsCount, "search_time", searchTime));
    }

    public void trackReranking(String sessionId, String query, int documentsCount, double rerankingTime,
                               Map<String, Object> metadata) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("reranking.query_length", query == null ? 0 : query.length());
        attributes.put("reranking.documents_count", documentsCount);
        attributes.put("reranking.time", rerankingTime);
        if (metadata != null) {
            metadata.forEach((key, value) -> attributes.put("reranking." + key, value));
        }

        track(sessionId, "document_reranking", "reranking", SpanKind.CLIENT, attributes,
                Map.of("documents_count", documentsCount, "reranking_time", rerankingTime));
    }

    public void trackLlmCall(String sessionId, String provider, String model, String prompt, String response,
                             Map<String, Object> metadata) {
        try {
            MonitoringSession session = lookup(sessionId);
            if (session != null) {
                session.addLlmCall(new MonitoringSession.LlmCall(
                        Instant.now(), provider, model, prompt, response,
                        metadata == null ? Map.of() : metadata));
            }
            if (!enabled) {
                return;
            }

            Map<String, Object> attributes = baseAttributes(sessionId, session);
            attributes.put("llm.provider", provider);
            attributes.put("llm.model", model);
            attributes.put("llm.prompt_length", prompt == null ? 0 : prompt.length());
            attributes.put("llm.response_length", response == null ? 0 : response.length());
            responseQuality(prompt, response).forEach((key, value) -> attributes.put("llm.quality." + key, value));
            if (metadata != null) {
                metadata.forEach((key, value) -> attributes.put("llm.metadata." + key, value));
            }

            sink.emit("llm_call_" + provider + "_" + model, SpanKind.CLIENT, TraceAttributes.toPrimitive(attributes));
            log.debug("Tracked LLM call {}/{} for session {}", provider, model, sessionId);
        } catch (RuntimeException e) {
            log.warn("Failed to track LLM call for session {}", sessionId, e);
        }
    }

    /**
     * Track a vector store operation (load, delete, evaluation results, ...).
     * Metadata may hold nested structures; they are serialized before emission.
     */
    public void trackVectorstoreOperation(String sessionId, String operationType, String collectionName,
                                          Map<String, Object> metadata) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("vectorstore.operation", operationType);
        attributes.put("vectorstore.collection", collectionName);
        if (metadata != null) {
            attributes.putAll(metadata);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operationType);
        details.put("collection", collectionName);
        track(sessionId, "vectorstore_" + operationType, "vectorstore_operation", SpanKind.CLIENT, attributes, details);
    }

    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", enabled ? "healthy" : "disabled");
        health.put("project_name", serviceName);
        health.put("active_sessions", sessions.size());
        health.put("total_llm_calls", sessions.values().stream().mapToInt(MonitoringSession::llmCallCount).sum());
        health.put("total_actions", sessions.values().stream().mapToInt(MonitoringSession::actionCount).sum());
        return health;
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private void track(String sessionId, String spanName, String actionType, SpanKind kind,
                       Map<String, Object> attributes, Map<String, Object> details) {
        try {
            MonitoringSession session = lookup(sessionId);
            if (session != null) {
                session.addAction(new MonitoringSession.SessionAction(actionType, Instant.now(), details));
            }
            if (!enabled) {
                return;
            }

            Map<String, Object> all = baseAttributes(sessionId, session);
            all.putAll(attributes);
            sink.emit(spanName, kind, TraceAttributes.toPrimitive(all));
            log.debug("Tracked {} for session {}", actionType, sessionId);
        } catch (RuntimeException e) {
            log.warn("Failed to track {} for session {}", actionType, sessionId, e);
        }
    }

    private MonitoringSession lookup(String sessionId) {
        return sessionId == null ? null : sessions.get(sessionId);
    }

    private Map<String, Object> baseAttributes(String sessionId, MonitoringSession session) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("service.name", serviceName);
        attributes.put("service.version", serviceVersion);
        attributes.put("session.id", sessionId);
        if (session != null) {
            attributes.put("session.user_id", session.getUserId());
            attributes.put("session.start_time", session.getStartTime().toString());
            attributes.put("session.actions_count", session.actionCount());
            attributes.put("session.llm_calls_count", session.llmCallCount());
        }
        return attributes;
    }

    private SessionSummary summarize(MonitoringSession session, Instant endTime, double durationSeconds) {
        List<MonitoringSession.SessionAction> actions = session.actions();
        List<MonitoringSession.LlmCall> llmCalls = session.llmCalls();

        Map<String, Integer> actionTypes = new TreeMap<>();
        for (MonitoringSession.SessionAction action : actions) {
            actionTypes.merge(action.type(), 1, Integer::sum);
        }

        SessionSummary.LlmUsage llm = null;
        if (!llmCalls.isEmpty()) {
            llm = new SessionSummary.LlmUsage(
                    llmCalls.size(),
                    llmCalls.stream().map(MonitoringSession.LlmCall::provider).distinct().sorted().toList(),
                    llmCalls.stream().map(MonitoringSession.LlmCall::model).distinct().sorted().toList(),
                    llmCalls.stream()
                            .mapToInt(call -> call.response() == null ? 0 : call.response().length())
                            .average()
                            .orElse(0.0)
            );
        }

        double actionsPerMinute = actions.size() / Math.max(durationSeconds / 60.0, 1.0);

        return new SessionSummary(
                session.getSessionId(),
                session.getUserId(),
                session.getStartTime(),
                endTime,
                durationSeconds,
                actions.size(),
                llmCalls.size(),
                actionsPerMinute,
                actionTypes,
                llm
        );
    }

    /**
     * Cheap lexical heuristics attached to LLM spans:
     * - coherence: response/prompt word ratio, capped and scaled to [0, 1]
     * - relevance: share of prompt words that reappear in the response
     * - completeness: response length normalized to 1000 characters
     */
    static Map<String, Double> responseQuality(String prompt, String response) {
        String safePrompt = prompt == null ? "" : prompt;
        String safeResponse = response == null ? "" : response;

        Set<String> promptWords = words(safePrompt);
        Set<String> responseWords = words(safeResponse);
        int promptLength = safePrompt.isBlank() ? 0 : safePrompt.trim().split("\\s+").length;
        int responseLength = safeResponse.isBlank() ? 0 : safeResponse.trim().split("\\s+").length;

        double coherence = Math.min((double) responseLength / Math.max(promptLength, 1), 2.0) / 2.0;

        double relevance = 0.0;
        if (!promptWords.isEmpty()) {
            Set<String> shared = new HashSet<>(promptWords);
            shared.retainAll(responseWords);
            relevance = (double) shared.size() / promptWords.size();
        }

        double completeness = Math.min(safeResponse.length() / 1000.0, 1.0);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("coherence", coherence);
        metrics.put("relevance", relevance);
        metrics.put("completeness", completeness);
        return metrics;
    }

    private static Set<String> words(String text) {
        if (text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase().trim().split("\\s+")).collect(Collectors.toSet());
    }
}
