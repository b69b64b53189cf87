package com.example.LusLaboris.monitoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final metrics of an ended session. {@link #empty()} is returned for
 * unknown or already ended sessions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSummary(
        String sessionId,
        String userId,
        Instant startTime,
        Instant endTime,
        double durationSeconds,
        int totalActions,
        int llmCallsCount,
        double actionsPerMinute,
        Map<String, Integer> actionTypes,
        LlmUsage llm
) {
    private static final SessionSummary EMPTY =
            new SessionSummary(null, null, null, null, 0.0, 0, 0, 0.0, Map.of(), null);

    public static SessionSummary empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sessionId == null;
    }

    public record LlmUsage(
            int totalCalls,
            List<String> providersUsed,
            List<String> modelsUsed,
            double avgResponseLength
    ) {
    }
}
