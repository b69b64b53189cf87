package com.example.LusLaboris.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Terminal value of one question/answer cycle. Failures are reported through
 * {@code success=false} and {@code error} rather than an exception.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerResult(
        boolean success,
        String question,
        String answer,
        String error,
        double processingTimeSeconds,
        Integer documentsRetrieved,
        Integer topK,
        Boolean rerankingApplied,
        List<DocumentPreview> documents,
        String sessionId
) {

    public static AnswerResult failed(String question, String error, double processingTimeSeconds, String sessionId) {
        return AnswerResult.builder()
                .success(false)
                .question(question)
                .error(error)
                .processingTimeSeconds(processingTimeSeconds)
                .sessionId(sessionId)
                .build();
    }
}
