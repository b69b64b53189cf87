package com.example.LusLaboris.controller;

import com.example.LusLaboris.config.OpenApiConfig;
import com.example.LusLaboris.monitoring.MonitoringService;
import com.example.LusLaboris.service.EvaluationService;
import com.example.LusLaboris.service.JobTrackerService;
import com.example.LusLaboris.service.RagGenerationService;
import com.example.LusLaboris.service.RerankingService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = OpenApiConfig.TagNames.STATUS)
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatusController {

    private final MonitoringService monitoringService;
    private final EvaluationService evaluationService;
    private final JobTrackerService jobTrackerService;
    private final RagGenerationService generationService;
    private final RerankingService rerankingService;

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> llm = new LinkedHashMap<>();
        llm.put("provider", generationService.providerName());
        llm.put("model", generationService.modelName());

        Map<String, Object> reranking = new LinkedHashMap<>();
        reranking.put("enabled", rerankingService.isEnabled());
        reranking.put("model", rerankingService.modelName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now().toString());
        body.put("llm", llm);
        body.put("reranking", reranking);
        body.put("monitoring", monitoringService.health());
        body.put("evaluation", evaluationService.health());
        body.put("jobs", jobTrackerService.summary());
        return body;
    }
}
