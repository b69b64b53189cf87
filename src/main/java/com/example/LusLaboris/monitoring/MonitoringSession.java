package com.example.LusLaboris.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Live correlation scope of one request. Actions and LLM calls are
 * append-only; every access goes through this object's monitor.
 */
public class MonitoringSession {

    private final String sessionId;
    private final String userId;
    private final Instant startTime;
    private final List<SessionAction> actions = new ArrayList<>();
    private final List<LlmCall> llmCalls = new ArrayList<>();

    public MonitoringSession(String sessionId, String userId, Instant startTime) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.startTime = startTime;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public synchronized void addAction(SessionAction action) {
        actions.add(action);
    }

    public synchronized void addLlmCall(LlmCall call) {
        llmCalls.add(call);
        actions.add(new SessionAction("llm_call", call.timestamp(),
                Map.of("provider", call.provider(), "model", call.model())));
    }

    public synchronized List<SessionAction> actions() {
        return List.copyOf(actions);
    }

    public synchronized List<LlmCall> llmCalls() {
        return List.copyOf(llmCalls);
    }

    public synchronized int actionCount() {
        return actions.size();
    }

    public synchronized int llmCallCount() {
        return llmCalls.size();
    }

    public record SessionAction(String type, Instant timestamp, Map<String, Object> details) {
    }

    public record LlmCall(
            Instant timestamp,
            String provider,
            String model,
            String prompt,
            String response,
            Map<String, Object> metadata
    ) {
    }
}
