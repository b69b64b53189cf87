package com.example.LusLaboris.rerank;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpCrossEncoderRerankerTest {

    private MockRestServiceServer server;
    private HttpCrossEncoderReranker reranker;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://reranker");
        server = MockRestServiceServer.bindTo(builder).build();
        reranker = new HttpCrossEncoderReranker(builder.build(), "BAAI/bge-reranker-base", true);
    }

    @Test
    void score_mapsSortedResponseBackToInputOrder() {
        server.expect(requestTo("http://reranker/rerank"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.query").value("¿vacaciones?"))
                .andExpect(jsonPath("$.texts.length()").value(3))
                .andExpect(jsonPath("$.raw_scores").value(false))
                .andRespond(withSuccess("""
                        [{"index": 2, "score": 0.91}, {"index": 0, "score": 0.40}, {"index": 1, "score": 0.05}]
                        """, MediaType.APPLICATION_JSON));

        List<Double> scores = reranker.score("¿vacaciones?", List.of("a", "b", "c"));

        assertEquals(List.of(0.40, 0.05, 0.91), scores);
        server.verify();
    }

    @Test
    void score_emptyInputSkipsTheCall() {
        assertTrue(reranker.score("q", List.of()).isEmpty());
        server.verify();
    }

    @Test
    void score_incompleteResponseIsAnError() {
        server.expect(requestTo("http://reranker/rerank"))
                .andRespond(withSuccess("[{\"index\": 0, \"score\": 0.4}]", MediaType.APPLICATION_JSON));

        assertThrows(IllegalStateException.class, () -> reranker.score("q", List.of("a", "b")));
    }

    @Test
    void score_serverErrorPropagates() {
        server.expect(requestTo("http://reranker/rerank")).andRespond(withServerError());

        assertThrows(RuntimeException.class, () -> reranker.score("q", List.of("a")));
    }
}
