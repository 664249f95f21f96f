package com.autobulk;

import com.autobulk.config.AutobulkProperties;
import com.autobulk.error.InvalidJobRequestException;
import com.autobulk.error.JobNotFoundException;
import com.autobulk.internal.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for creating, inspecting and cancelling bulk jobs.
 */
@Service
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);
    static final int DEFAULT_EXECUTION_LIMIT = 10;

    private final JobStore jobStore;
    private final ScheduleCalculator scheduleCalculator;
    private final AutobulkProperties properties;
    private final Clock clock;

    public SchedulingService(JobStore jobStore, ScheduleCalculator scheduleCalculator, AutobulkProperties properties,
            Clock clock) {
        this.jobStore = jobStore;
        this.scheduleCalculator = scheduleCalculator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates the request, computes the first run time and persists the job in status
     * {@code scheduled}.
     *
     * @throws InvalidJobRequestException when a required field is missing or inconsistent
     * @throws com.autobulk.error.InvalidScheduleException when the cron expression cannot be parsed
     */
    public Job createJob(JobCreateRequest request) {
        if (request == null) {
            throw new InvalidJobRequestException("Job request must not be null");
        }
        String name = requireText(request.name(), "name");
        String templateId = requireText(request.templateId(), "templateId");
        ScheduleKind kind = request.scheduleKind();
        if (kind == null) {
            throw new InvalidJobRequestException("scheduleKind is required");
        }

        List<String> recipients = normalizeRecipients(request.recipients());
        Map<String, String> filter = request.recipientFilter() == null || request.recipientFilter().isEmpty()
                ? null
                : new LinkedHashMap<>(request.recipientFilter());
        if ((recipients == null) == (filter == null)) {
            throw new InvalidJobRequestException("Provide either recipients or recipientFilter, but not both");
        }

        if (kind == ScheduleKind.DELAYED && request.runAt() == null) {
            throw new InvalidJobRequestException("Delayed jobs require runAt");
        }
        String cron = request.cronExpression() == null ? null : request.cronExpression().trim();
        if (kind == ScheduleKind.RECURRING && (cron == null || cron.isEmpty())) {
            throw new InvalidJobRequestException("Recurring jobs require cronExpression");
        }
        int maxRetries = request.maxRetries() != null
                ? request.maxRetries()
                : properties.getJobs().getDefaultMaxRetries();
        if (maxRetries < 0) {
            throw new InvalidJobRequestException("maxRetries must be >= 0");
        }

        OffsetDateTime now = now();
        Job job = new Job(UUID.randomUUID(), name, templateId, kind, maxRetries);
        if (kind == ScheduleKind.DELAYED) {
            job.setRunAt(request.runAt().withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (kind == ScheduleKind.RECURRING) {
            job.setCronExpression(cron);
        }
        job.setRecipientSource(recipients != null ? RecipientSource.STATIC_LIST : RecipientSource.FILTER);
        job.setRecipients(recipients);
        job.setRecipientFilter(filter);
        job.setNextRunAt(scheduleCalculator.computeNextRun(job, now));
        job.setCreatedAt(now);
        job.setUpdatedAt(now);

        Job saved = jobStore.createJob(job);
        log.info("Created {} job {} '{}' (template {}), next run at {}", kind.storedValue(), saved.getId(),
                name, templateId, saved.getNextRunAt());
        return saved;
    }

    public List<Job> listJobs() {
        return jobStore.listJobs();
    }

    public Optional<Job> findJob(UUID jobId) {
        return jobStore.findJob(jobId);
    }

    public Job getJob(UUID jobId) {
        return jobStore.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Job cancelJob(UUID jobId) {
        Job cancelled = jobStore.cancelJob(jobId, now());
        log.info("Cancelled job {}", jobId);
        return cancelled;
    }

    public List<JobExecution> recentExecutions(UUID jobId) {
        return recentExecutions(jobId, DEFAULT_EXECUTION_LIMIT);
    }

    public List<JobExecution> recentExecutions(UUID jobId, int limit) {
        return jobStore.recentExecutions(jobId, limit);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidJobRequestException(field + " must not be blank");
        }
        return value.trim();
    }

    private List<String> normalizeRecipients(List<String> recipients) {
        if (recipients == null) {
            return null;
        }
        List<String> normalized = new ArrayList<>(recipients.size());
        for (String recipient : recipients) {
            if (recipient != null && !recipient.trim().isEmpty()) {
                normalized.add(recipient.trim());
            }
        }
        return normalized.isEmpty() ? null : normalized;
    }
}
