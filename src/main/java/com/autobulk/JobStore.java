package com.autobulk;

import com.autobulk.error.InvalidJobRequestException;
import com.autobulk.error.JobNotFoundException;
import com.autobulk.internal.RetryPolicy;
import com.autobulk.internal.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional boundary around jobs and their executions. Every state transition of a job goes
 * through this class, and every public operation runs in a transaction of its own.
 */
@Component
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final JobRepository jobRepository;
    private final JobExecutionRepository executionRepository;
    private final TransactionTemplate transactionTemplate;
    private final ScheduleCalculator scheduleCalculator;
    private final RetryPolicy retryPolicy;

    public JobStore(
            JobRepository jobRepository,
            JobExecutionRepository executionRepository,
            TransactionTemplate transactionTemplate,
            ScheduleCalculator scheduleCalculator,
            RetryPolicy retryPolicy) {
        this.jobRepository = jobRepository;
        this.executionRepository = executionRepository;
        this.transactionTemplate = transactionTemplate;
        this.scheduleCalculator = scheduleCalculator;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Persists a job assembled by {@link SchedulingService}. The recipient source must agree with
     * exactly one of the static list and the filter.
     */
    Job createJob(Job job) {
        requireSingleRecipientSource(job);
        return transactionTemplate.execute(status -> jobRepository.save(job));
    }

    public List<Job> listDueJobs(OffsetDateTime now) {
        List<Job> due = transactionTemplate.execute(status -> jobRepository.findDueJobs(now, JobStatus.CLAIMABLE));
        return due == null ? List.of() : due;
    }

    public List<Job> listJobs() {
        List<Job> jobs = transactionTemplate.execute(status -> jobRepository.findAllByOrderByCreatedAtDesc());
        return jobs == null ? List.of() : jobs;
    }

    public Optional<Job> findJob(UUID jobId) {
        return Optional.ofNullable(transactionTemplate.execute(status -> jobRepository.findById(jobId).orElse(null)));
    }

    public Job cancelJob(UUID jobId, OffsetDateTime now) {
        return transactionTemplate.execute(status -> {
            Job job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            job.cancel(now);
            return jobRepository.save(job);
        });
    }

    public List<JobExecution> recentExecutions(UUID jobId, int limit) {
        if (limit < 1) {
            throw new InvalidJobRequestException("limit must be >= 1");
        }
        List<JobExecution> executions = transactionTemplate.execute(status -> {
            if (!jobRepository.existsById(jobId)) {
                throw new JobNotFoundException(jobId);
            }
            return executionRepository.findByJobIdOrderByCreatedAtDescAttemptDesc(jobId, PageRequest.of(0, limit));
        });
        return executions == null ? List.of() : executions;
    }

    /**
     * Moves a due job to {@code running} and opens its execution record, committing both before
     * returning. An empty result means the job was cancelled, already claimed or no longer due.
     */
    public Optional<JobClaim> claim(UUID jobId, OffsetDateTime now) {
        return Optional.ofNullable(transactionTemplate.execute(status -> {
            int updated = jobRepository.claim(jobId, JobStatus.RUNNING, JobStatus.CLAIMABLE, now);
            if (updated == 0) {
                return null;
            }
            Job job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            JobExecution execution = executionRepository.save(JobExecution.start(job, now));
            return new JobClaim(job, execution);
        }));
    }

    /**
     * Finalizes a successful execution: the retry counter resets and the schedule advances. The next
     * run of a recurring job is computed before anything is modified, so an
     * {@link com.autobulk.error.InvalidScheduleException} leaves the execution open for
     * {@link #recordFailure}. An execution the reaper released still counts when it is the job's
     * latest one; once the job was claimed again only the execution record is updated.
     */
    public Job recordSuccess(UUID executionId, int dispatched, Map<String, Object> details, OffsetDateTime now) {
        return transactionTemplate.execute(status -> {
            JobExecution execution = loadExecution(executionId);
            Job job = jobRepository.findById(execution.getJobId())
                    .orElseThrow(() -> new JobNotFoundException(execution.getJobId()));
            if (execution.isAbandoned()) {
                if (!isLatestExecution(execution)) {
                    execution.markSucceeded(dispatched, details, now);
                    executionRepository.save(execution);
                    log.warn("Execution {} of job {} succeeded after it was released as stale; the job was "
                            + "claimed again, so it is left to the newer execution", executionId, job.getId());
                    return job;
                }
                log.warn("Execution {} of job {} succeeded after it was released as stale; "
                        + "discarding the retry scheduled for {}", executionId, job.getId(), job.getNextRunAt());
            }
            OffsetDateTime nextRunAt = !job.isCancelled() && job.getScheduleKind() == ScheduleKind.RECURRING
                    ? scheduleCalculator.computeNextRun(job, now)
                    : null;

            execution.markSucceeded(dispatched, details, now);
            job.setRetryCount(0);
            job.setLastError(null);
            job.setUpdatedAt(now);
            if (job.isCancelled()) {
                log.info("Job {} was cancelled while running; keeping it cancelled", job.getId());
            } else {
                job.setNextRunAt(nextRunAt);
                job.setStatus(nextRunAt != null ? JobStatus.SCHEDULED : JobStatus.COMPLETED);
            }
            executionRepository.save(execution);
            return jobRepository.save(job);
        });
    }

    /**
     * Finalizes a failed execution and applies the retry policy to its job. A failure reported for
     * an execution the reaper already released changes nothing, since the release counted it.
     */
    public Job recordFailure(UUID executionId, String errorMessage, OffsetDateTime now) {
        return transactionTemplate.execute(status -> {
            JobExecution execution = loadExecution(executionId);
            Job job = jobRepository.findById(execution.getJobId())
                    .orElseThrow(() -> new JobNotFoundException(execution.getJobId()));
            if (execution.isAbandoned()) {
                log.warn("Execution {} of job {} failed after it was released as stale; keeping the outcome "
                        + "recorded at release: {}", executionId, job.getId(), errorMessage);
                return job;
            }

            execution.markFailed(errorMessage, now);
            applyFailure(job, errorMessage, now);
            executionRepository.save(execution);
            return jobRepository.save(job);
        });
    }

    /**
     * Fails the open executions of jobs stuck in {@code running} since before {@code cutoff} and
     * applies the retry policy to those jobs. Each job is released through a guarded update, so a job
     * finalized between the scan and its release is skipped. A dispatch that was only slow can still
     * report its outcome afterwards, see {@link #recordSuccess} and {@link #recordFailure}.
     *
     * @return the number of jobs released
     */
    public int reapStaleRunning(OffsetDateTime cutoff, OffsetDateTime now) {
        Integer reaped = transactionTemplate.execute(status -> {
            List<Job> candidates = jobRepository.findByStatusAndUpdatedAtBefore(JobStatus.RUNNING, cutoff);
            int released = 0;
            for (Job candidate : candidates) {
                UUID jobId = candidate.getId();
                String reason = "job stayed running since " + candidate.getUpdatedAt();
                if (jobRepository.releaseStale(jobId, JobStatus.RUNNING, cutoff, now) == 0) {
                    log.debug("Job {} was finalized before it could be released", jobId);
                    continue;
                }
                Job job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
                for (JobExecution execution : executionRepository.findByJobIdAndStatus(jobId,
                        ExecutionStatus.RUNNING)) {
                    execution.markAbandoned(reason, now);
                    executionRepository.save(execution);
                }
                applyFailure(job, JobExecution.ABANDONED_PREFIX + reason, now);
                jobRepository.save(job);
                released++;
                log.warn("Released stale running job {} (status now {})", jobId, job.getStatus().storedValue());
            }
            return released;
        });
        return reaped == null ? 0 : reaped;
    }

    private void applyFailure(Job job, String errorMessage, OffsetDateTime now) {
        job.setLastError(errorMessage);
        job.setUpdatedAt(now);
        if (job.isCancelled()) {
            return;
        }

        RetryPolicy.RetryDecision decision = retryPolicy.onFailure(job.getRetryCount(), job.getMaxRetries(), now);
        job.setRetryCount(decision.retryCount());
        job.setStatus(decision.status());
        job.setNextRunAt(decision.nextRunAt());
        if (decision.isDeadLetter()) {
            log.error("Job {} moved to dead-letter after {} failed attempts: {}", job.getId(), decision.retryCount(),
                    errorMessage);
        } else {
            log.info("Job {} scheduled for retry {} of {} at {}", job.getId(), decision.retryCount(),
                    job.getMaxRetries(), decision.nextRunAt());
        }
    }

    private boolean isLatestExecution(JobExecution execution) {
        List<JobExecution> latest = executionRepository.findByJobIdOrderByCreatedAtDescAttemptDesc(
                execution.getJobId(), PageRequest.of(0, 1));
        return !latest.isEmpty() && latest.get(0).getId().equals(execution.getId());
    }

    private static void requireSingleRecipientSource(Job job) {
        boolean hasRecipients = job.getRecipients() != null && !job.getRecipients().isEmpty();
        boolean hasFilter = job.getRecipientFilter() != null && !job.getRecipientFilter().isEmpty();
        if (hasRecipients == hasFilter) {
            throw new InvalidJobRequestException("Job " + job.getId()
                    + " must have either recipients or a recipient filter, but not both");
        }
        RecipientSource expected = hasRecipients ? RecipientSource.STATIC_LIST : RecipientSource.FILTER;
        if (job.getRecipientSource() != expected) {
            throw new InvalidJobRequestException("Job " + job.getId() + " declares recipient source "
                    + job.getRecipientSource() + " but carries " + expected.storedValue() + " recipients");
        }
    }

    private JobExecution loadExecution(UUID executionId) {
        return executionRepository.findById(executionId)
                .orElseThrow(() -> new IllegalStateException("Execution " + executionId + " not found"));
    }
}
