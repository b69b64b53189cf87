package com.example.LusLaboris.model;

import java.time.Instant;
import java.util.Map;

/**
 * Mutable job record owned by the job tracker. State changes go through the
 * synchronized transition methods so that pollers never observe a half-written
 * record; readers take a {@link JobView} snapshot.
 *
 * Transitions only move forward: QUEUED -> PROCESSING -> COMPLETED | FAILED.
 * QUEUED -> FAILED is allowed when the work could not be scheduled.
 */
public class Job {

    private final String jobId;
    private final String operation;
    private final String user;
    private final String collectionName;
    private final String filename;
    private final Instant createdAt;

    private JobStatus status = JobStatus.QUEUED;
    private Instant startedAt;
    private Instant completedAt;
    private Map<String, Object> result;
    private String error;
    private String sessionId;

    public Job(String jobId, String operation, String user, String collectionName, String filename) {
        this.jobId = jobId;
        this.operation = operation;
        this.user = user;
        this.collectionName = collectionName;
        this.filename = filename;
        this.createdAt = Instant.now();
    }

    public String getJobId() {
        return jobId;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized void start(String sessionId) {
        requireStatus(JobStatus.QUEUED);
        this.status = JobStatus.PROCESSING;
        this.startedAt = Instant.now();
        this.sessionId = sessionId;
    }

    public synchronized void complete(Map<String, Object> result) {
        requireStatus(JobStatus.PROCESSING);
        this.status = JobStatus.COMPLETED;
        this.completedAt = Instant.now();
        this.result = result == null ? Map.of() : result;
    }

    public synchronized void fail(String error) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " already finished as " + status.value());
        }
        this.status = JobStatus.FAILED;
        this.completedAt = Instant.now();
        this.error = error == null ? "unknown error" : error;
    }

    public synchronized JobView snapshot() {
        return new JobView(
                jobId,
                status,
                operation,
                user,
                collectionName,
                filename,
                createdAt,
                startedAt,
                completedAt,
                result,
                error,
                sessionId
        );
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Job " + jobId + " is " + status.value() + ", expected " + expected.value());
        }
    }
}
