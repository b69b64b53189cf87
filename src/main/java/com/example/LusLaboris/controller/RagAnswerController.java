package com.example.LusLaboris.controller;

import com.example.LusLaboris.config.OpenApiConfig;
import com.example.LusLaboris.model.AnswerResult;
import com.example.LusLaboris.model.QuestionRequest;
import com.example.LusLaboris.monitoring.MonitoringService;
import com.example.LusLaboris.service.RagAnswerService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;

@RestController
@Tag(name = OpenApiConfig.TagNames.RAG)
@RequestMapping("/api/rag")
@RequiredArgsConstructor
public class RagAnswerController {

    private final RagAnswerService ragAnswerService;
    private final MonitoringService monitoringService;

    /**
     * Answer a labor-law question. Failures are reported in the body
     * ({@code success=false}) with status 200.
     */
    @PostMapping("/ask")
    public AnswerResult ask(@Valid @RequestBody QuestionRequest request, Principal principal) {
        String sessionId = monitoringService.createSession(principal == null ? null : principal.getName());
        try {
            return ragAnswerService.answer(request.question(), sessionId);
        } finally {
            monitoringService.endSession(sessionId);
        }
    }
}
