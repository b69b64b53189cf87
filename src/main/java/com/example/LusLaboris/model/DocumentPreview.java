package com.example.LusLaboris.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport view of a retrieved article. The article text is cut to a short
 * preview; the full text only travels on the evaluation path.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentPreview(
        long id,
        double score,
        Double rerankScore,
        Map<String, Object> payload
) {

    public static DocumentPreview of(RetrievedDocument doc, int previewLength) {
        String content = doc.articleText();
        String preview = content.length() > previewLength
                ? content.substring(0, previewLength) + "..."
                : content;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(RetrievedDocument.ARTICLE_NUMBER, doc.articleNumber());
        payload.put(RetrievedDocument.CHAPTER_DESCRIPTION, doc.payload().get(RetrievedDocument.CHAPTER_DESCRIPTION));
        payload.put(RetrievedDocument.ARTICLE_TEXT, preview);

        return new DocumentPreview(
                doc.id(),
                round(doc.score()),
                doc.rerankScore() == null ? null : round(doc.rerankScore()),
                payload
        );
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
