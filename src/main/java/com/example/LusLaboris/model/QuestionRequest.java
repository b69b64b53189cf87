package com.example.LusLaboris.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request payload for asking a labor-law question.
 *
 * @param question question in natural language (Spanish expected)
 */
public record QuestionRequest(
        @NotBlank
        @Size(min = 5, max = 1000)
        String question
) {
}
