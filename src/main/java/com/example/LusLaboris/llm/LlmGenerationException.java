package com.example.LusLaboris.llm;

/**
 * Raised when answer generation fails after the retry budget is spent.
 */
public class LlmGenerationException extends RuntimeException {

    public LlmGenerationException(String message) {
        super(message);
    }

    public LlmGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
