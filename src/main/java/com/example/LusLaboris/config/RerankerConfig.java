package com.example.LusLaboris.config;

import com.example.LusLaboris.rerank.HttpCrossEncoderReranker;
import com.example.LusLaboris.rerank.Reranker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RerankerConfig {

    private static final Logger log = LoggerFactory.getLogger(RerankerConfig.class);

    @Bean
    public Reranker reranker(RagProperties properties) {
        RagProperties.Reranking settings = properties.getReranking();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.getTimeout());
        requestFactory.setReadTimeout(settings.getTimeout());

        RestClient restClient = RestClient.builder()
                .baseUrl(settings.getUrl())
                .requestFactory(requestFactory)
                .build();

        if (settings.isEnabled()) {
            log.info("Reranking enabled: {} at {}", settings.getModel(), settings.getUrl());
        }
        return new HttpCrossEncoderReranker(restClient, settings.getModel(), settings.isEnabled());
    }
}
