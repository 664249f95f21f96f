package com.autobulk;

import com.autobulk.convert.DetailsJsonConverter;
import com.autobulk.convert.ExecutionStatusConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * One attempt at running a {@link Job}. Finalized exactly once, immutable afterwards.
 */
@Entity
@Table(name = "autobulk_job_executions")
public class JobExecution {

    static final String ABANDONED_PREFIX = "Execution abandoned: ";

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Convert(converter = ExecutionStatusConverter.class)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    @Column(name = "attempt")
    private int attempt = 1;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    @Column(name = "error")
    private String error;

    @Column(name = "emails_sent")
    private int emailsSent = 0;

    @Convert(converter = DetailsJsonConverter.class)
    @Column(name = "details")
    private Map<String, Object> details;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public JobExecution() {
    }

    public JobExecution(UUID id, UUID jobId, int attempt) {
        this.id = id;
        this.jobId = jobId;
        this.attempt = attempt;
    }

    /**
     * Opens a running execution for a freshly claimed job. The attempt number follows the job's
     * current retry counter.
     */
    public static JobExecution start(Job job, OffsetDateTime now) {
        JobExecution execution = new JobExecution(UUID.randomUUID(), job.getId(), job.getRetryCount() + 1);
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setStartedAt(now);
        execution.setCreatedAt(now);
        return execution;
    }

    /**
     * Records a successful outcome. An execution already released as abandoned may still be
     * confirmed here, because its dispatch was only slow.
     */
    public void markSucceeded(int dispatched, Map<String, Object> resultDetails, OffsetDateTime now) {
        if (!isAbandoned()) {
            requireRunning();
        }
        this.status = ExecutionStatus.SUCCEEDED;
        this.error = null;
        this.emailsSent = dispatched;
        this.details = resultDetails;
        this.finishedAt = now;
    }

    public void markFailed(String errorMessage, OffsetDateTime now) {
        requireRunning();
        this.status = ExecutionStatus.FAILED;
        this.error = errorMessage;
        this.finishedAt = now;
    }

    /**
     * Fails a running execution whose dispatch is presumed dead.
     */
    public void markAbandoned(String reason, OffsetDateTime now) {
        markFailed(ABANDONED_PREFIX + reason, now);
    }

    public boolean isAbandoned() {
        return status == ExecutionStatus.FAILED && error != null && error.startsWith(ABANDONED_PREFIX);
    }

    public boolean isFinished() {
        return status == ExecutionStatus.SUCCEEDED || status == ExecutionStatus.FAILED;
    }

    private void requireRunning() {
        if (status != ExecutionStatus.RUNNING) {
            throw new IllegalStateException("Execution " + id + " is " + status.storedValue() + " and cannot be finalized");
        }
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(OffsetDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public int getEmailsSent() {
        return emailsSent;
    }

    public void setEmailsSent(int emailsSent) {
        this.emailsSent = emailsSent;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
