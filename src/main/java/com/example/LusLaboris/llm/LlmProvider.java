package com.example.LusLaboris.llm;

/**
 * One LLM backend: submit a prompt, receive completion text.
 * Exactly one implementation is active per deployment, chosen at startup.
 */
public interface LlmProvider {

    /**
     * @return trimmed completion text, never blank
     * @throws RuntimeException on any backend failure; callers decide about retries
     */
    String complete(String prompt);

    /** Provider identifier used in traces, e.g. "openai". */
    String provider();

    /** Model identifier used in traces, e.g. "gpt-4o-mini". */
    String model();
}
