package com.example.LusLaboris.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationMetricsTest {

    @Test
    void overallQuality_perfectScores() {
        assertEquals(1.0, EvaluationMetrics.overallQuality(1.0, 0.0, 0.0), 1e-9);
    }

    @Test
    void overallQuality_renormalizesOverAvailableScores() {
        // 0.5 * 0.5 + 0.4 * (1 - 0.5) over a total weight of 0.9
        assertEquals(0.45 / 0.9, EvaluationMetrics.overallQuality(0.5, 0.5, null), 1e-9);
        assertEquals(1.0, EvaluationMetrics.overallQuality(null, null, 0.0), 1e-9);
    }

    @Test
    void overallQuality_nullWhenNothingAvailable() {
        assertNull(EvaluationMetrics.overallQuality(null, null, null));
    }

    @Test
    void of_derivesGroundingFromHallucination() {
        EvaluationMetrics metrics = EvaluationMetrics.of(1.0, 0.25, null, 1.2);

        assertEquals(0.75, metrics.grounding(), 1e-9);
        assertNull(metrics.toxicity());

        assertNull(EvaluationMetrics.of(1.0, null, 0.0, 0.5).grounding());
    }
}
