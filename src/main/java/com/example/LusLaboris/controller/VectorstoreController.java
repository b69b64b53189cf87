package com.example.LusLaboris.controller;

import com.example.LusLaboris.config.OpenApiConfig;
import com.example.LusLaboris.model.CollectionInfo;
import com.example.LusLaboris.model.JobView;
import com.example.LusLaboris.model.LoadToVectorstoreRequest;
import com.example.LusLaboris.monitoring.MonitoringService;
import com.example.LusLaboris.service.JobTrackerService;
import com.example.LusLaboris.service.VectorstoreLoadService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vector store administration:
 *  - asynchronous loading of processed law files (polled through /jobs)
 *  - collection listing, inspection and deletion
 */
@RestController
@Tag(name = OpenApiConfig.TagNames.VECTORSTORE)
@RequestMapping("/api/data")
@RequiredArgsConstructor
public class VectorstoreController {

    private static final String ANONYMOUS = "anonymous";

    private final VectorstoreLoadService loadService;
    private final JobTrackerService jobTrackerService;
    private final MonitoringService monitoringService;

    /**
     * Queue a load job and return 202 right away.
     *  POST /api/data/load-to-vectorstore-local
     *  {"filename": "codigo_trabajo_articulos.json", "replaceCollection": true}
     */
    @PostMapping("/load-to-vectorstore-local")
    public ResponseEntity<Map<String, Object>> loadToVectorstoreLocal(
            @Valid @RequestBody LoadToVectorstoreRequest request,
            Principal principal
    ) {
        String user = principal == null ? ANONYMOUS : principal.getName();
        String jobId = jobTrackerService.submit(
                VectorstoreLoadService.OPERATION,
                user,
                loadService.collectionName(),
                request.filename(),
                sessionId -> loadService.loadFromLocalFile(request, sessionId).toMap()
        );

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Load job accepted");
        body.put("jobId", jobId);
        body.put("jobStatusUrl", "/api/data/jobs/" + jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/jobs")
    public Map<String, Object> listJobs() {
        List<JobView> jobs = jobTrackerService.list();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobs", jobs);
        body.put("count", jobs.size());
        return body;
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobView> getJob(@PathVariable String jobId) {
        return jobTrackerService.get(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/collections")
    public Map<String, Object> listCollections() {
        List<String> collections = loadService.listCollections();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("collections", collections);
        body.put("count", collections.size());
        return body;
    }

    @GetMapping("/collections/{name}")
    public ResponseEntity<CollectionInfo> getCollection(@PathVariable String name) {
        return loadService.getCollectionInfo(name)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/collections/{name}")
    public ResponseEntity<Map<String, Object>> deleteCollection(@PathVariable String name, Principal principal) {
        String sessionId = monitoringService.createSession(principal == null ? ANONYMOUS : principal.getName());
        try {
            if (!loadService.deleteCollection(name, sessionId)) {
                return ResponseEntity.notFound().build();
            }
        } finally {
            monitoringService.endSession(sessionId);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Collection '" + name + "' deleted successfully");
        return ResponseEntity.ok(body);
    }
}
