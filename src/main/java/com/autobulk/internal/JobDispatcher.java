package com.autobulk.internal;

import com.autobulk.Job;
import com.autobulk.JobClaim;
import com.autobulk.JobExecution;
import com.autobulk.JobStore;
import com.autobulk.delivery.BulkSendResult;
import com.autobulk.delivery.DispatchContext;
import com.autobulk.delivery.MessageSender;
import com.autobulk.delivery.RecipientResolver;
import com.autobulk.delivery.RenderedMessage;
import com.autobulk.delivery.TemplateRenderer;
import com.autobulk.error.InvalidScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-writer dispatch loop. Each tick claims the due jobs one after the other, runs them
 * through the recipient, rendering and delivery collaborators, and records the outcome.
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore jobStore;
    private final RecipientResolver recipientResolver;
    private final TemplateRenderer templateRenderer;
    private final MessageSender messageSender;
    private final Clock clock;
    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);

    public JobDispatcher(
            JobStore jobStore,
            RecipientResolver recipientResolver,
            TemplateRenderer templateRenderer,
            MessageSender messageSender,
            Clock clock) {
        this.jobStore = jobStore;
        this.recipientResolver = recipientResolver;
        this.templateRenderer = templateRenderer;
        this.messageSender = messageSender;
        this.clock = clock;
    }

    /**
     * Runs every job due now.
     *
     * @return the number of jobs claimed and run by this tick; 0 when another tick is still running
     */
    public int tick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            log.debug("Skipping dispatch tick because the previous one is still running");
            return 0;
        }
        try {
            List<Job> due = jobStore.listDueJobs(now());
            if (due.isEmpty()) {
                return 0;
            }
            log.debug("Found {} due job(s)", due.size());

            int processed = 0;
            for (Job job : due) {
                Optional<JobClaim> claim = claim(job.getId());
                if (claim.isPresent()) {
                    run(claim.get());
                    processed++;
                }
            }
            return processed;
        } finally {
            tickInProgress.set(false);
        }
    }

    /**
     * Blocks the calling thread, ticking every {@code pollInterval} until the thread is
     * interrupted. With {@code runOnce} a single tick is run and the method returns, and a zero
     * interval is accepted.
     */
    public void start(Duration pollInterval, boolean runOnce) {
        if (pollInterval == null || pollInterval.isNegative() || (pollInterval.isZero() && !runOnce)) {
            throw new IllegalArgumentException("pollInterval must be positive unless runOnce is set");
        }
        log.info("Dispatch loop started (poll interval {}, run once: {})", pollInterval, runOnce);
        while (!Thread.currentThread().isInterrupted()) {
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("Dispatch tick failed", e);
            }
            if (runOnce) {
                return;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Dispatch loop stopped");
    }

    private Optional<JobClaim> claim(UUID jobId) {
        try {
            Optional<JobClaim> claim = jobStore.claim(jobId, now());
            if (claim.isEmpty()) {
                log.debug("Job {} is no longer claimable; skipping", jobId);
            }
            return claim;
        } catch (RuntimeException e) {
            log.error("Failed to claim job {}", jobId, e);
            return Optional.empty();
        }
    }

    private void run(JobClaim claim) {
        Job job = claim.job();
        JobExecution execution = claim.execution();
        DispatchContext context = new DispatchContext(job.getId(), execution.getId(), execution.getAttempt());
        log.debug("Running job {} (execution {}, attempt {})", job.getId(), execution.getId(), execution.getAttempt());

        List<String> recipients;
        BulkSendResult result;
        try {
            recipients = recipientResolver.resolve(job);
            RenderedMessage message = templateRenderer.render(job.getTemplateId(), context);
            result = messageSender.sendBulk(message, recipients, context);
        } catch (Exception e) {
            log.error("Execution {} of job {} failed", execution.getId(), job.getId(), e);
            recordFailure(job.getId(), execution.getId(), describe(e));
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipients", recipients);
        details.put("templateId", result.templateId());
        try {
            Job updated = jobStore.recordSuccess(execution.getId(), result.totalDispatched(), details, now());
            log.info("Job {} dispatched to {} recipient(s); status {}, next run at {}", job.getId(),
                    result.totalDispatched(), updated.getStatus().storedValue(), updated.getNextRunAt());
        } catch (InvalidScheduleException e) {
            log.error("Job {} ran but its next run could not be computed", job.getId(), e);
            recordFailure(job.getId(), execution.getId(), describe(e));
        } catch (RuntimeException e) {
            log.error("Failed to record success of execution {} for job {}; its stored state is unchanged",
                    execution.getId(), job.getId(), e);
        }
    }

    private void recordFailure(UUID jobId, UUID executionId, String errorMessage) {
        try {
            jobStore.recordFailure(executionId, errorMessage, now());
        } catch (RuntimeException e) {
            log.error("Failed to record failure of execution {} for job {}; its stored state is unchanged",
                    executionId, jobId, e);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
