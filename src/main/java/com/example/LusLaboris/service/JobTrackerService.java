package com.example.LusLaboris.service;

import com.example.LusLaboris.config.AsyncConfig;
import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.model.Job;
import com.example.LusLaboris.model.JobStatus;
import com.example.LusLaboris.model.JobView;
import com.example.LusLaboris.monitoring.MonitoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory tracker for long-running background jobs.
 *
 * Jobs are registered as QUEUED and run on the job executor; callers poll
 * {@link #get(String)} for progress. Every job gets its own monitoring
 * session, which is ended when the work finishes either way.
 */
@Service
public class JobTrackerService {

    private static final Logger log = LoggerFactory.getLogger(JobTrackerService.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final TaskExecutor executor;
    private final MonitoringService monitoringService;
    private final Duration retention;

    public JobTrackerService(@Qualifier(AsyncConfig.JOB_EXECUTOR) TaskExecutor executor,
                             MonitoringService monitoringService,
                             RagProperties properties) {
        this.executor = executor;
        this.monitoringService = monitoringService;
        this.retention = properties.getJobs().getRetention();
    }

    /**
     * Register a job and schedule its work. Returns immediately with the job id.
     *
     * @param work receives the job's monitoring session id and returns the job result
     */
    public String submit(String operation, String user, String collectionName, String filename,
                         Function<String, Map<String, Object>> work) {
        String jobId = UUID.randomUUID().toString();
        Job job = new Job(jobId, operation, user, collectionName, filename);
        jobs.put(jobId, job);
        log.info("Job {} queued: {} on {} by {}", jobId, operation, collectionName, user);

        try {
            executor.execute(() -> run(job, work));
        } catch (TaskRejectedException e) {
            log.error("Job {} could not be scheduled", jobId, e);
            job.fail("Job could not be scheduled: " + e.getMessage());
        }
        return jobId;
    }

    public Optional<JobView> get(String jobId) {
        Job job = jobId == null ? null : jobs.get(jobId);
        return Optional.ofNullable(job).map(Job::snapshot);
    }

    /**
     * Snapshots of all known jobs, newest first.
     */
    public List<JobView> list() {
        return jobs.values().stream()
                .map(Job::snapshot)
                .sorted(Comparator.comparing(JobView::createdAt).reversed())
                .toList();
    }

    /**
     * Drop finished jobs that completed more than {@code olderThan} ago.
     *
     * @return number of removed jobs
     */
    public int prune(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        int before = jobs.size();
        jobs.values().removeIf(job -> {
            Instant completedAt = job.getCompletedAt();
            return job.getStatus().isTerminal() && completedAt != null && completedAt.isBefore(cutoff);
        });
        int removed = before - jobs.size();
        if (removed > 0) {
            log.info("Pruned {} finished jobs older than {}", removed, olderThan);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${lus-laboris.jobs.prune-interval-ms:600000}")
    public void pruneExpired() {
        prune(retention);
    }

    public Map<String, Object> summary() {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }
        jobs.values().forEach(job -> counts.merge(job.getStatus(), 1, Integer::sum));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", jobs.size());
        counts.forEach((status, count) -> summary.put(status.value(), count));
        return summary;
    }

    private void run(Job job, Function<String, Map<String, Object>> work) {
        String sessionId = monitoringService.createSession(job.snapshot().user());
        try {
            job.start(sessionId);
            log.info("Job {} processing", job.getJobId());

            Map<String, Object> result = work.apply(sessionId);
            job.complete(result);
            log.info("Job {} completed", job.getJobId());
        } catch (RuntimeException e) {
            log.error("Job {} failed", job.getJobId(), e);
            job.fail(describe(e));
        } catch (Error e) {
            log.error("Job {} aborted", job.getJobId(), e);
            job.fail(describe(e));
            throw e;
        } finally {
            monitoringService.endSession(sessionId);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
