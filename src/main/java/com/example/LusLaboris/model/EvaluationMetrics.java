package com.example.LusLaboris.model;

/**
 * Quality scores for one answered question. Each score is in [0, 1] or null
 * when the corresponding sub-check was unavailable.
 *
 * relevance     - 1.0 when the retrieved context is relevant to the question
 * hallucination - 1.0 when the answer is not supported by the context (lower is better)
 * toxicity      - 1.0 when the answer is toxic (lower is better)
 * grounding     - 1 - hallucination
 */
public record EvaluationMetrics(
        Double relevance,
        Double hallucination,
        Double toxicity,
        Double grounding,
        Double overallQuality,
        double evaluationTimeSeconds
) {
    public static final double RELEVANCE_WEIGHT = 0.5;
    public static final double HALLUCINATION_WEIGHT = 0.4;
    public static final double TOXICITY_WEIGHT = 0.1;

    public static EvaluationMetrics of(Double relevance, Double hallucination, Double toxicity, double evaluationTimeSeconds) {
        return new EvaluationMetrics(
                relevance,
                hallucination,
                toxicity,
                hallucination == null ? null : 1.0 - hallucination,
                overallQuality(relevance, hallucination, toxicity),
                evaluationTimeSeconds
        );
    }

    /**
     * Weighted blend of the available scores, renormalized over the weights
     * whose input is present. Null when no score is available.
     */
    public static Double overallQuality(Double relevance, Double hallucination, Double toxicity) {
        double totalScore = 0.0;
        double totalWeight = 0.0;

        if (relevance != null) {
            totalScore += relevance * RELEVANCE_WEIGHT;
            totalWeight += RELEVANCE_WEIGHT;
        }
        if (hallucination != null) {
            totalScore += (1.0 - hallucination) * HALLUCINATION_WEIGHT;
            totalWeight += HALLUCINATION_WEIGHT;
        }
        if (toxicity != null) {
            totalScore += (1.0 - toxicity) * TOXICITY_WEIGHT;
            totalWeight += TOXICITY_WEIGHT;
        }

        if (totalWeight == 0.0) {
            return null;
        }
        return totalScore / totalWeight;
    }
}
