package com.example.LusLaboris.monitoring;

import com.example.LusLaboris.config.RagProperties;
import io.opentelemetry.api.trace.SpanKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringServiceTest {

    @Mock
    private MonitoringSink sink;

    private RagProperties properties;
    private MonitoringService monitoringService;

    @BeforeEach
    void setUp() {
        properties = new RagProperties();
        monitoringService = new MonitoringService(sink, properties);
    }

    @Test
    void createSession_returnsDistinctIds() {
        String first = monitoringService.createSession();
        String second = monitoringService.createSession("user-1");

        assertNotEquals(first, second);
        assertEquals(2, monitoringService.activeSessionCount());
    }

    @Test
    void endSession_isIdempotent() {
        // Given
        String sessionId = monitoringService.createSession("user-1");
        monitoringService.trackEmbeddingGeneration(sessionId, "¿Cuántos días de vacaciones?", "text-embedding-3-small", 0.12);

        // When
        SessionSummary first = monitoringService.endSession(sessionId);
        SessionSummary second = monitoringService.endSession(sessionId);

        // Then
        assertFalse(first.isEmpty());
        assertEquals(sessionId, first.sessionId());
        assertEquals("user-1", first.userId());
        assertEquals(1, first.totalActions());
        assertTrue(second.isEmpty());
        assertEquals(0, monitoringService.activeSessionCount());
    }

    @Test
    void endSession_unknownIdReturnsEmptySummary() {
        assertTrue(monitoringService.endSession("does-not-exist").isEmpty());
        assertTrue(monitoringService.endSession(null).isEmpty());
    }

    @Test
    void endSession_summarizesActionsAndLlmCalls() {
        // Given
        String sessionId = monitoringService.createSession();
        monitoringService.trackEmbeddingGeneration(sessionId, "pregunta", "text-embedding-3-small", 0.1);
        monitoringService.trackVectorstoreSearch(sessionId, "pregunta", 5, 0.05);
        monitoringService.trackLlmCall(sessionId, "openai", "gpt-4o-mini", "prompt", "respuesta larga", Map.of());
        monitoringService.trackLlmCall(sessionId, "deepseek", "deepseek-chat", "prompt", "otra", Map.of());

        // When
        SessionSummary summary = monitoringService.endSession(sessionId);

        // Then
        assertEquals(4, summary.totalActions());
        assertEquals(2, summary.llmCallsCount());
        assertEquals(Map.of("embedding_generation", 1, "vectorstore_search", 1, "llm_call", 2), summary.actionTypes());
        assertNotNull(summary.llm());
        assertEquals(List.of("deepseek", "openai"), summary.llm().providersUsed());
        assertEquals(List.of("deepseek-chat", "gpt-4o-mini"), summary.llm().modelsUsed());
        assertEquals(("respuesta larga".length() + "otra".length()) / 2.0, summary.llm().avgResponseLength(), 1e-9);
        // duration is far below one minute, so the rate is the plain action count
        assertEquals(4.0, summary.actionsPerMinute(), 1e-9);
    }

    @Test
    void tracking_unknownSessionStillEmitsAndNeverThrows() {
        assertDoesNotThrow(() -> monitoringService.trackVectorstoreSearch("missing", "q", 3, 0.1));
        assertDoesNotThrow(() -> monitoringService.trackLlmCall(null, "openai", "gpt-4o-mini", null, null, null));

        verify(sink).emit(eq("vectorstore_search"), eq(SpanKind.CLIENT), anyMap());
        verify(sink).emit(eq("llm_call_openai_gpt-4o-mini"), eq(SpanKind.CLIENT), anyMap());
    }

    @Test
    void tracking_sinkFailureIsSwallowed() {
        doThrow(new IllegalStateException("collector down")).when(sink).emit(anyString(), any(), anyMap());
        String sessionId = monitoringService.createSession();

        assertDoesNotThrow(() -> monitoringService.trackReranking(sessionId, "q", 10, 0.3,
                Map.of("reranking_applied", true)));
        assertEquals(1, monitoringService.endSession(sessionId).totalActions());
    }

    @SuppressWarnings("unchecked")
    @Test
    void trackVectorstoreOperation_flattensNestedMetadata() {
        // Given
        String sessionId = monitoringService.createSession();
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);

        // When
        monitoringService.trackVectorstoreOperation(sessionId, "llm_evaluation", "evaluation_results",
                Map.of("scores", Map.of("relevance", 1.0), "documents_count", 3));

        // Then
        verify(sink).emit(eq("vectorstore_llm_evaluation"), eq(SpanKind.CLIENT), captor.capture());
        Map<String, Object> attributes = captor.getValue();
        assertEquals("{\"relevance\":1.0}", attributes.get("scores"));
        assertEquals(3L, attributes.get("documents_count"));
        assertEquals("evaluation_results", attributes.get("vectorstore.collection"));
        assertEquals("null", attributes.get("session.user_id"));
    }

    @Test
    void disabledMonitoring_recordsButDoesNotEmit() {
        properties.getMonitoring().setEnabled(false);
        MonitoringService disabled = new MonitoringService(sink, properties);
        String sessionId = disabled.createSession();

        disabled.trackLlmCall(sessionId, "openai", "gpt-4o-mini", "p", "r", Map.of());

        verifyNoInteractions(sink);
        assertEquals(1, disabled.endSession(sessionId).llmCallsCount());
        assertEquals("disabled", disabled.health().get("status"));
    }

    @Test
    void responseQuality_scoresOverlapAndLength() {
        Map<String, Double> quality = MonitoringService.responseQuality("vacaciones del trabajador", "vacaciones anuales");

        assertEquals(1.0 / 3.0, quality.get("relevance"), 1e-9);
        assertEquals((2.0 / 3.0) / 2.0, quality.get("coherence"), 1e-9);
        assertEquals("vacaciones anuales".length() / 1000.0, quality.get("completeness"), 1e-9);
    }
}
