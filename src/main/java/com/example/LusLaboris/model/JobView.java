package com.example.LusLaboris.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a {@link Job}, returned to status pollers.
 * Timestamps serialize as ISO-8601 strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobView(
        String jobId,
        JobStatus status,
        String operation,
        String user,
        String collectionName,
        String filename,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Map<String, Object> result,
        String error,
        String sessionId
) {
}
