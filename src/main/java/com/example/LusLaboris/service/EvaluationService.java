package com.example.LusLaboris.service;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.llm.EvaluationClassifier;
import com.example.LusLaboris.model.EvaluationMetrics;
import com.example.LusLaboris.model.EvaluationTask;
import com.example.LusLaboris.monitoring.MonitoringService;
import com.example.LusLaboris.util.EvaluationPrompts;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Background quality evaluation of answered questions.
 *
 * One dedicated consumer thread drains a bounded FIFO queue. For every task
 * three classifier checks (relevance, hallucination, toxicity) run
 * concurrently on Reactor's bounded-elastic scheduler; a check that fails or
 * times out contributes null and leaves a hung classifier call behind without
 * holding up later tasks. The blended result is emitted as a single
 * monitoring span and then discarded.
 *
 * Shutdown queues a sentinel behind pending tasks, so the queue drains before
 * the worker stops, within {@code lus-laboris.evaluation.shutdown-timeout}.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    static final String OPERATION_TYPE = "llm_evaluation";
    static final String COLLECTION_NAME = "evaluation_results";

    private static final EvaluationTask POISON =
            new EvaluationTask(null, "", "", "", List.of(), Map.of(), Instant.EPOCH);

    private final EvaluationClassifier classifier;
    private final MonitoringService monitoringService;
    private final boolean enabled;
    private final Duration checkTimeout;
    private final Duration shutdownTimeout;
    private final BlockingQueue<EvaluationTask> queue;
    private final int queueCapacity;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private final ExecutorService worker;

    public EvaluationService(EvaluationClassifier classifier, MonitoringService monitoringService,
                             RagProperties properties) {
        RagProperties.Evaluation settings = properties.getEvaluation();
        this.classifier = classifier;
        this.monitoringService = monitoringService;
        this.enabled = settings.isEnabled() && classifier.isAvailable();
        this.checkTimeout = settings.getCheckTimeout();
        this.shutdownTimeout = settings.getShutdownTimeout();
        this.queueCapacity = settings.getQueueCapacity();
        this.queue = new LinkedBlockingQueue<>(queueCapacity);

        if (!enabled) {
            log.warn("Evaluation service disabled ({})",
                    settings.isEnabled() ? "no classifier model available" : "disabled by configuration");
            this.worker = null;
            return;
        }

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("evaluation-worker-");
        threadFactory.setDaemon(true);
        this.worker = Executors.newSingleThreadExecutor(threadFactory);
        this.worker.submit(this::consume);
        log.info("Evaluation service started with model {}", settings.getModel());
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Non-blocking hand-off. Returns false when the task was not queued
     * (disabled, shutting down or queue full).
     */
    public boolean enqueue(EvaluationTask task) {
        if (!enabled || task == null) {
            return false;
        }
        if (shuttingDown.get()) {
            log.warn("Evaluation service is shutting down, dropping task for session {}", task.sessionId());
            dropped.incrementAndGet();
            return false;
        }
        if (!queue.offer(task)) {
            log.warn("Evaluation queue full ({} tasks), dropping task for session {}", queueCapacity, task.sessionId());
            dropped.incrementAndGet();
            return false;
        }
        log.debug("Evaluation enqueued for session {}", task.sessionId());
        return true;
    }

    @PreDestroy
    public void shutdown() {
        if (!enabled || !shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down evaluation service, {} tasks pending", queue.size());

        try {
            if (!queue.offer(POISON, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Could not queue shutdown signal within {}", shutdownTimeout);
            }
            worker.shutdown();
            if (!worker.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Evaluation worker did not finish within {}, {} tasks abandoned",
                        shutdownTimeout, queue.size());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
        log.info("Evaluation service shut down (processed={}, failed={})", processed.get(), failed.get());
    }

    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", enabled ? "healthy" : "disabled");
        health.put("enabled", enabled);
        health.put("queue_size", queue.size());
        health.put("queue_capacity", queueCapacity);
        health.put("processed", processed.get());
        health.put("failed", failed.get());
        health.put("dropped", dropped.get());
        return health;
    }

    long processedCount() {
        return processed.get();
    }

    private void consume() {
        log.info("Evaluation worker started");
        while (true) {
            EvaluationTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Evaluation worker interrupted, {} tasks left in queue", queue.size());
                return;
            }
            if (task == POISON) {
                log.info("Evaluation worker stopped");
                return;
            }

            try {
                evaluate(task);
                processed.incrementAndGet();
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                log.error("Failed to run evaluation for session {}", task.sessionId(), e);
            }
        }
    }

    EvaluationMetrics evaluate(EvaluationTask task) {
        log.info("Running parallel evaluations for session {}", task.sessionId());
        long start = System.nanoTime();

        CompletableFuture<Double> relevance = check("relevance", task,
                () -> parseRelevance(classifier.classify(EvaluationPrompts.relevance(task.question(), task.context()))));
        CompletableFuture<Double> hallucination = check("hallucination", task,
                () -> parseHallucination(classifier.classify(
                        EvaluationPrompts.hallucination(task.question(), task.context(), task.answer()))));
        CompletableFuture<Double> toxicity = check("toxicity", task,
                () -> parseToxicity(classifier.classify(EvaluationPrompts.toxicity(task.answer()))));

        CompletableFuture.allOf(relevance, hallucination, toxicity).join();

        double evaluationTime = (System.nanoTime() - start) / 1_000_000_000.0;
        EvaluationMetrics metrics = EvaluationMetrics.of(
                relevance.join(), hallucination.join(), toxicity.join(), evaluationTime);

        monitoringService.trackVectorstoreOperation(task.sessionId(), OPERATION_TYPE, COLLECTION_NAME,
                spanMetadata(metrics, task));

        log.info("Parallel evaluation completed for session {} in {}s: {}",
                task.sessionId(), String.format("%.2f", evaluationTime), metrics);
        return metrics;
    }

    private CompletableFuture<Double> check(String name, EvaluationTask task, Supplier<Double> supplier) {
        return Mono.fromCallable(supplier::get)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(checkTimeout)
                .doOnError(e -> log.error("{} evaluation failed for session {}", name, task.sessionId(), e))
                .onErrorResume(e -> Mono.empty())
                .toFuture();
    }

    private static Map<String, Object> spanMetadata(EvaluationMetrics metrics, EvaluationTask task) {
        String question = task.question() == null ? "" : task.question();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("evaluation_type", "llm_classifier");
        metadata.put("relevance_score", metrics.relevance());
        metadata.put("hallucination_score", metrics.hallucination());
        metadata.put("toxicity_score", metrics.toxicity());
        metadata.put("grounding_score", metrics.grounding());
        metadata.put("overall_quality_score", metrics.overallQuality());
        metadata.put("evaluation_time_seconds", metrics.evaluationTimeSeconds());
        metadata.put("question", question.length() > 200 ? question.substring(0, 200) : question);
        metadata.put("answer_length", task.answer() == null ? 0 : task.answer().length());
        metadata.put("context_length", task.context() == null ? 0 : task.context().length());
        metadata.put("documents_count", task.documents().size());
        metadata.put("evaluation_timestamp", task.timestamp().toString());
        return metadata;
    }

    // "irrelevant" contains "relevant", so the negative label is checked first
    static double parseRelevance(String label) {
        String text = normalize(label);
        if (text.contains("irrelevant")) {
            return 0.0;
        }
        if (text.contains("relevant")) {
            return 1.0;
        }
        return 0.5;
    }

    static double parseHallucination(String label) {
        String text = normalize(label);
        if (text.contains("factual")) {
            return 0.0;
        }
        if (text.contains("hallucinat")) {
            return 1.0;
        }
        return 0.5;
    }

    static double parseToxicity(String label) {
        String text = normalize(label);
        if (text.contains("no-tóxico") || text.contains("no tóxico") || text.contains("no toxico")
                || text.contains("no-toxico") || text.contains("non-toxic")) {
            return 0.0;
        }
        if (text.contains("tóxico") || text.contains("toxico") || text.contains("toxic")) {
            return 1.0;
        }
        return 0.0;
    }

    private static String normalize(String label) {
        return label == null ? "" : label.toLowerCase(Locale.ROOT);
    }
}
