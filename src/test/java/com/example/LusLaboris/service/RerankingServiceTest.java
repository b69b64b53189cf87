package com.example.LusLaboris.service;

import com.example.LusLaboris.model.RetrievalResult;
import com.example.LusLaboris.model.RetrievedDocument;
import com.example.LusLaboris.rerank.Reranker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RerankingServiceTest {

    @Mock
    private Reranker reranker;

    private RerankingService rerankingService;

    @BeforeEach
    void setUp() {
        rerankingService = new RerankingService(reranker);
    }

    @Test
    void rerank_sortsByRerankScoreAndCutsToTopK() {
        // Given
        List<RetrievedDocument> candidates = List.of(
                doc(1, 0.90, "De las vacaciones", "art 1"),
                doc(2, 0.85, "Del salario", "art 2"),
                doc(3, 0.80, "De la jornada", "art 3"),
                doc(4, 0.75, "Del preaviso", "art 4"));
        when(reranker.isEnabled()).thenReturn(true);
        when(reranker.model()).thenReturn("BAAI/bge-reranker-base");
        when(reranker.score(eq("pregunta"), anyList())).thenReturn(List.of(0.1, 0.9, 0.5, 0.7));

        // When
        RetrievalResult result = rerankingService.rerank("pregunta", candidates, 2);

        // Then
        assertEquals(List.of(2L, 4L), result.documents().stream().map(RetrievedDocument::id).toList());
        assertEquals(0.9, result.documents().get(0).rerankScore());
        assertTrue(result.rerankingApplied());
        assertEquals(4, result.metadata().get("documents_reranked"));
        assertEquals(2, result.metadata().get("documents_returned"));
        @SuppressWarnings("unchecked")
        Map<String, Object> range = (Map<String, Object>) result.metadata().get("rerank_scores_range");
        assertEquals(0.1, (double) range.get("min"), 1e-9);
        assertEquals(0.9, (double) range.get("max"), 1e-9);
        assertEquals(0.55, (double) range.get("mean"), 1e-9);
        verify(reranker).score("pregunta", List.of("De las vacaciones: art 1", "Del salario: art 2",
                "De la jornada: art 3", "Del preaviso: art 4"));
    }

    @Test
    void rerank_failureReturnsEveryCandidateInSearchOrder() {
        // Given
        List<RetrievedDocument> candidates = List.of(
                doc(1, 0.90, "c", "a"), doc(2, 0.85, "c", "b"), doc(3, 0.80, "c", "c"), doc(4, 0.75, "c", "d"));
        when(reranker.isEnabled()).thenReturn(true);
        when(reranker.model()).thenReturn("BAAI/bge-reranker-base");
        when(reranker.score(anyString(), anyList())).thenThrow(new IllegalStateException("reranker down"));

        // When
        RetrievalResult result = rerankingService.rerank("q", candidates, 2);

        // Then
        assertFalse(result.rerankingApplied());
        assertEquals("reranker down", result.metadata().get("error"));
        assertEquals(List.of(1L, 2L, 3L, 4L), result.documents().stream().map(RetrievedDocument::id).toList());
        assertNull(result.documents().get(0).rerankScore());
    }

    @Test
    void rerank_disabledPassesThrough() {
        List<RetrievedDocument> candidates = List.of(doc(1, 0.9, "c", "a"));
        when(reranker.isEnabled()).thenReturn(false);

        RetrievalResult result = rerankingService.rerank("q", candidates, 5);

        assertFalse(result.rerankingApplied());
        assertEquals(candidates, result.documents());
        verify(reranker, never()).score(anyString(), anyList());
    }

    static RetrievedDocument doc(long id, double score, String chapter, String article) {
        return new RetrievedDocument(id, score, null, Map.of(
                RetrievedDocument.CHAPTER_DESCRIPTION, chapter,
                RetrievedDocument.ARTICLE_TEXT, article,
                RetrievedDocument.ARTICLE_NUMBER, id));
    }
}
