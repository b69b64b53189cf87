package com.example.LusLaboris.service;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.llm.LlmGenerationException;
import com.example.LusLaboris.llm.LlmProvider;
import com.example.LusLaboris.model.RetrievedDocument;
import com.example.LusLaboris.monitoring.MonitoringService;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.LusLaboris.service.RerankingServiceTest.doc;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RagGenerationServiceTest {

    private static final String QUESTION = "¿Cuántos días de vacaciones corresponden?";

    @Mock
    private LlmProvider llmProvider;

    @Mock
    private MonitoringService monitoringService;

    private RagProperties properties;
    private RagGenerationService generationService;

    @BeforeEach
    void setUp() {
        properties = new RagProperties();
        // keep retries fast; the production schedule is checked separately
        properties.getLlm().getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getLlm().getRetry().setMaxBackoff(Duration.ofMillis(5));
        generationService = new RagGenerationService(llmProvider, monitoringService, properties);
    }

    @Test
    void generate_emptyDocumentsNeverCallsTheLlm() {
        String answer = generationService.generate(QUESTION, List.of(), "session-1");

        assertEquals(RagGenerationService.NO_DOCUMENTS_ANSWER, answer);
        verify(llmProvider, never()).complete(anyString());
        verifyNoInteractions(monitoringService);
    }

    @Test
    void generate_groundsPromptInContextAndTracksCall() {
        // Given
        List<RetrievedDocument> documents = List.of(doc(218, 0.91, "De las vacaciones",
                "Todo trabajador tiene derecho a doce días hábiles de vacaciones."));
        when(llmProvider.provider()).thenReturn("openai");
        when(llmProvider.model()).thenReturn("gpt-4o-mini");
        when(llmProvider.complete(anyString())).thenReturn("Corresponden 12 días hábiles (Artículo 218).");

        // When
        String answer = generationService.generate(QUESTION, documents, "session-1");

        // Then
        assertEquals("Corresponden 12 días hábiles (Artículo 218).", answer);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmProvider).complete(prompt.capture());
        assertTrue(prompt.getValue().startsWith("Eres un asistente especializado en derecho laboral paraguayo."));
        assertTrue(prompt.getValue().contains("CONTEXTO:\nDocumento 1:\nTodo trabajador tiene derecho"));
        assertTrue(prompt.getValue().contains("PREGUNTA: " + QUESTION));
        assertTrue(prompt.getValue().endsWith("RESPUESTA:"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(monitoringService).trackLlmCall(eq("session-1"), eq("openai"), eq("gpt-4o-mini"),
                eq(prompt.getValue()), eq(answer), metadata.capture());
        assertEquals(1, metadata.getValue().get("documents_count"));
        assertEquals(QUESTION, metadata.getValue().get("query"));
    }

    @Test
    void generate_placeholderLikeTextIsInsertedVerbatim() {
        List<RetrievedDocument> documents = List.of(doc(95, 0.8, "Del contrato",
                "El contrato indicará {query} y demás condiciones."));
        when(llmProvider.provider()).thenReturn("openai");
        when(llmProvider.model()).thenReturn("gpt-4o-mini");
        when(llmProvider.complete(anyString())).thenReturn("respuesta");

        generationService.generate("¿Qué dice {context} del contrato?", documents, "session-1");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmProvider).complete(prompt.capture());
        assertTrue(prompt.getValue().contains("El contrato indicará {query} y demás condiciones."));
        assertTrue(prompt.getValue().contains("PREGUNTA: ¿Qué dice {context} del contrato?"));
    }

    @Test
    void generate_retriesTransientFailures() {
        when(llmProvider.provider()).thenReturn("openai");
        when(llmProvider.model()).thenReturn("gpt-4o-mini");
        when(llmProvider.complete(anyString()))
                .thenThrow(new IllegalStateException("503"))
                .thenReturn("respuesta");

        String answer = generationService.generate(QUESTION, List.of(doc(1, 0.9, "c", "a")), "session-1");

        assertEquals("respuesta", answer);
        verify(llmProvider, times(2)).complete(anyString());
    }

    @Test
    void generate_exhaustedRetriesRaiseAfterThreeAttempts() {
        // Given
        when(llmProvider.provider()).thenReturn("openai");
        when(llmProvider.model()).thenReturn("gpt-4o-mini");
        when(llmProvider.complete(anyString())).thenThrow(new IllegalStateException("rate limited"));
        List<Long> waits = new ArrayList<>();
        generationService.retry().getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval().toMillis()));

        // When
        LlmGenerationException e = assertThrows(LlmGenerationException.class,
                () -> generationService.generate(QUESTION, List.of(doc(1, 0.9, "c", "a")), "session-1"));

        // Then
        assertTrue(e.getMessage().contains("rate limited"));
        verify(llmProvider, times(3)).complete(anyString());
        assertEquals(List.of(1L, 2L), waits);
        verify(monitoringService, never()).trackLlmCall(any(), any(), any(), any(), any(), anyMap());
    }

    @Test
    void defaultBackoffWaitsTwoThenFourSeconds() {
        IntervalFunction backoff = RagGenerationService.backoff(new RagProperties().getLlm().getRetry());

        assertEquals(2_000L, backoff.apply(1));
        assertEquals(4_000L, backoff.apply(2));
        assertEquals(60_000L, backoff.apply(10));
        assertEquals(3, RagGenerationService.retryConfig(new RagProperties().getLlm().getRetry()).getMaxAttempts());
    }

    @Test
    void buildContext_usesFallbacksForMissingFields() {
        RetrievedDocument bare = new RetrievedDocument(7, 0.5, null, Map.of());

        String context = generationService.buildContext(List.of(doc(218, 0.9, "De las vacaciones", "texto"), bare));

        assertEquals("Documento 1:\ntexto [Capítulo: De las vacaciones - Artículo número: 218]\n"
                + "Documento 2:\nTexto no disponible [Capítulo: Descripción no disponible - Artículo número: N/A]",
                context);
        assertEquals("No se encontraron documentos relevantes.", generationService.buildContext(List.of()));
    }
}
