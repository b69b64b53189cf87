package com.example.LusLaboris.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;
import java.util.Objects;

/**
 * One statute article returned by the vector store.
 *
 * @param id          row id in the vector store
 * @param score       cosine similarity from the vector search
 * @param rerankScore cross-encoder score, null when reranking was not applied
 * @param payload     article fields (articulo, capitulo_descripcion, articulo_numero, ...)
 */
public record RetrievedDocument(
        long id,
        double score,
        Double rerankScore,
        Map<String, Object> payload
) {
    public static final String ARTICLE_TEXT = "articulo";
    public static final String CHAPTER_DESCRIPTION = "capitulo_descripcion";
    public static final String ARTICLE_NUMBER = "articulo_numero";

    public RetrievedDocument {
        payload = payload == null ? Map.of() : payload;
    }

    public RetrievedDocument withRerankScore(double value) {
        return new RetrievedDocument(id, score, value, payload);
    }

    @JsonIgnore
    public String articleText() {
        return stringField(ARTICLE_TEXT, "");
    }

    @JsonIgnore
    public String chapterDescription() {
        return stringField(CHAPTER_DESCRIPTION, "");
    }

    @JsonIgnore
    public Object articleNumber() {
        return payload.get(ARTICLE_NUMBER);
    }

    /**
     * Text handed to the cross encoder: "chapter description: article".
     */
    @JsonIgnore
    public String rerankText() {
        return chapterDescription() + ": " + articleText();
    }

    public String stringField(String key, String fallback) {
        Object value = payload.get(key);
        return value == null ? fallback : Objects.toString(value);
    }
}
