package com.example.LusLaboris.rerank;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reranker backed by a text-embeddings-inference style endpoint:
 *
 *   POST /rerank {"query": "...", "texts": [...], "raw_scores": false}
 *   -> [{"index": 0, "score": 0.93}, ...]
 *
 * The server returns results sorted by score; they are mapped back to input order here.
 */
public class HttpCrossEncoderReranker implements Reranker {

    private static final Logger log = LoggerFactory.getLogger(HttpCrossEncoderReranker.class);

    private final RestClient restClient;
    private final String model;
    private final boolean enabled;

    public HttpCrossEncoderReranker(RestClient restClient, String model, boolean enabled) {
        this.restClient = restClient;
        this.model = model;
        this.enabled = enabled;
    }

    @Override
    public List<Double> score(String query, List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        RerankScore[] response = restClient.post()
                .uri("/rerank")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new RerankRequest(query, texts, false))
                .retrieve()
                .body(RerankScore[].class);

        if (response == null || response.length != texts.size()) {
            throw new IllegalStateException("Reranker returned "
                    + (response == null ? 0 : response.length) + " scores for " + texts.size() + " texts");
        }

        List<Double> scores = new ArrayList<>(Collections.nCopies(texts.size(), (Double) null));
        for (RerankScore item : response) {
            if (item.index() < 0 || item.index() >= texts.size()) {
                throw new IllegalStateException("Reranker returned out-of-range index " + item.index());
            }
            scores.set(item.index(), item.score());
        }
        if (scores.contains(null)) {
            throw new IllegalStateException("Reranker response is missing scores");
        }

        log.debug("Reranked {} texts with {}", texts.size(), model);
        return scores;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    record RerankRequest(
            String query,
            List<String> texts,
            @JsonProperty("raw_scores") boolean rawScores
    ) {
    }

    record RerankScore(int index, double score) {
    }
}
