package com.example.LusLaboris.llm;

/**
 * LLM used as a label classifier by the answer evaluator.
 * The raw label text is returned; interpretation is up to the caller.
 */
public interface EvaluationClassifier {

    String classify(String prompt);

    default boolean isAvailable() {
        return true;
    }

    /**
     * Placeholder used when no classifier model is configured; evaluation
     * disables itself when it sees one.
     */
    static EvaluationClassifier unavailable(String reason) {
        return new EvaluationClassifier() {
            @Override
            public String classify(String prompt) {
                throw new IllegalStateException("Evaluation classifier unavailable: " + reason);
            }

            @Override
            public boolean isAvailable() {
                return false;
            }
        };
    }
}
