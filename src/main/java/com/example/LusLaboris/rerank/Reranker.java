package com.example.LusLaboris.rerank;

import java.util.List;

/**
 * Cross-encoder scoring of (query, text) pairs.
 */
public interface Reranker {

    /**
     * @return one score per text, in the same order as {@code texts}
     */
    List<Double> score(String query, List<String> texts);

    String model();

    boolean isEnabled();
}
