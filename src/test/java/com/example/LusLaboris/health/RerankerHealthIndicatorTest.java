package com.example.LusLaboris.health;

import com.example.LusLaboris.rerank.Reranker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RerankerHealthIndicatorTest {

    @Mock
    private Reranker reranker;

    @InjectMocks
    private RerankerHealthIndicator indicator;

    @Test
    void health_disabledRerankerIsUpWithoutCallingIt() {
        when(reranker.isEnabled()).thenReturn(false);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("disabled", health.getDetails().get("status"));
        verify(reranker, never()).score(anyString(), anyList());
    }

    @Test
    void health_scoresFixedPair() {
        when(reranker.isEnabled()).thenReturn(true);
        when(reranker.model()).thenReturn("BAAI/bge-reranker-base");
        when(reranker.score("health-check", List.of("health-check"))).thenReturn(List.of(7.25));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(7.25, health.getDetails().get("score.same"));
        assertEquals("BAAI/bge-reranker-base", health.getDetails().get("model"));
    }

    @Test
    void health_downOnUnusableScore() {
        when(reranker.isEnabled()).thenReturn(true);
        when(reranker.model()).thenReturn("BAAI/bge-reranker-base");
        when(reranker.score(anyString(), anyList())).thenReturn(List.of(Double.NaN));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    void health_downWhenEndpointFails() {
        when(reranker.isEnabled()).thenReturn(true);
        when(reranker.model()).thenReturn("BAAI/bge-reranker-base");
        when(reranker.score(anyString(), anyList())).thenThrow(new IllegalStateException("Connection refused"));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(true, health.getDetails().get("enabled"));
    }
}
