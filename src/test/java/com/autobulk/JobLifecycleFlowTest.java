package com.autobulk;

import com.autobulk.config.AutobulkProperties;
import com.autobulk.delivery.CachedRecipientResolver;
import com.autobulk.delivery.DispatchContext;
import com.autobulk.delivery.MessageTransport;
import com.autobulk.delivery.PropertyTemplateRenderer;
import com.autobulk.delivery.RenderedMessage;
import com.autobulk.delivery.TransportMessageSender;
import com.autobulk.internal.JobDispatcher;
import com.autobulk.internal.RetryPolicy;
import com.autobulk.internal.ScheduleCalculator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives jobs through creation, dispatch, retry and dead-lettering with the default collaborators
 * and an in-memory store.
 */
class JobLifecycleFlowTest {

    private static final OffsetDateTime NOON = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final List<String> delivered = new ArrayList<>();
    private boolean transportDown;

    private InMemoryRepositories repositories;
    private MutableClock clock;
    private SchedulingService service;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        repositories = new InMemoryRepositories();
        clock = new MutableClock(NOON);
        AutobulkProperties properties = new AutobulkProperties();
        properties.getTemplates().put("welcome", new AutobulkProperties.Template("Hello", "Attempt ${attempt}"));

        ScheduleCalculator calculator = new ScheduleCalculator();
        JobStore jobStore = new JobStore(repositories.jobRepository, repositories.executionRepository,
                repositories.transactionTemplate, calculator, new RetryPolicy(properties));
        service = new SchedulingService(jobStore, calculator, properties, clock);

        MessageTransport transport = (String destination, RenderedMessage message, DispatchContext context) -> {
            if (transportDown) {
                throw new IllegalStateException("SMTP down");
            }
            delivered.add(destination + ":" + message.body());
        };
        dispatcher = new JobDispatcher(
                jobStore,
                new CachedRecipientResolver(Path.of("does-not-exist.csv"), "email", new ObjectMapper()),
                new PropertyTemplateRenderer(properties.getTemplates()),
                new TransportMessageSender(transport),
                clock);
    }

    @Test
    void shouldCompleteImmediateJobAfterOneTick() {
        Job job = service.createJob(JobCreateRequest.immediate("launch", "welcome",
                List.of("a@example.com", "b@example.com")));

        assertEquals(1, dispatcher.tick());

        Job after = service.getJob(job.getId());
        assertEquals(JobStatus.COMPLETED, after.getStatus());
        assertNull(after.getNextRunAt());
        List<JobExecution> executions = service.recentExecutions(job.getId());
        assertEquals(1, executions.size());
        JobExecution execution = executions.get(0);
        assertEquals(ExecutionStatus.SUCCEEDED, execution.getStatus());
        assertEquals(2, execution.getEmailsSent());
        assertEquals(List.of("a@example.com", "b@example.com"), execution.getDetails().get("recipients"));
        assertEquals("welcome", execution.getDetails().get("templateId"));
        assertEquals(List.of("a@example.com:Attempt 1", "b@example.com:Attempt 1"), delivered);

        assertEquals(0, dispatcher.tick());
    }

    @Test
    void shouldKeepRecurringJobScheduledAfterEachRun() {
        Job job = service.createJob(JobCreateRequest.recurring("digest", "welcome", "*/5 * * * *",
                Map.of("department", "sales")));
        assertEquals(NOON.plusMinutes(5), job.getNextRunAt());
        assertEquals(0, dispatcher.tick());

        for (int run = 1; run <= 3; run++) {
            clock.set(job.getNextRunAt());
            OffsetDateTime dispatchTime = clock.now();

            assertEquals(1, dispatcher.tick());

            job = service.getJob(job.getId());
            assertEquals(JobStatus.SCHEDULED, job.getStatus());
            assertThat(job.getNextRunAt()).isAfter(dispatchTime);
            assertEquals(dispatchTime.plusMinutes(5), job.getNextRunAt());
        }
        assertThat(delivered).containsOnly("demo+sales@example.com:Attempt 1");
        assertEquals(3, delivered.size());
    }

    @Test
    void shouldRetryWithBackoffAndDeadLetterAfterMaxRetries() {
        transportDown = true;
        Job job = service.createJob(JobCreateRequest.immediate("flaky", "welcome", List.of("a@example.com")));

        assertEquals(1, dispatcher.tick());
        job = service.getJob(job.getId());
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(1, job.getRetryCount());
        assertEquals(NOON.plusSeconds(30), job.getNextRunAt());
        assertThat(job.getLastError()).contains("SMTP down");

        clock.advance(Duration.ofSeconds(29));
        assertEquals(0, dispatcher.tick());

        long[] expectedDelays = { 60, 120 };
        for (long delay : expectedDelays) {
            clock.set(job.getNextRunAt());
            OffsetDateTime failureTime = clock.now();
            assertEquals(1, dispatcher.tick());
            job = service.getJob(job.getId());
            assertEquals(JobStatus.FAILED, job.getStatus());
            assertEquals(failureTime.plusSeconds(delay), job.getNextRunAt());
        }
        assertEquals(3, job.getRetryCount());

        clock.set(job.getNextRunAt());
        assertEquals(1, dispatcher.tick());
        job = service.getJob(job.getId());
        assertEquals(JobStatus.DEAD_LETTER, job.getStatus());
        assertEquals(4, job.getRetryCount());
        assertNull(job.getNextRunAt());

        clock.advance(Duration.ofDays(30));
        assertEquals(0, dispatcher.tick());
        assertThat(service.recentExecutions(job.getId(), 10))
                .extracting(JobExecution::getAttempt)
                .containsExactly(4, 3, 2, 1);
    }

    @Test
    void shouldResetRetryCounterAfterRecovery() {
        transportDown = true;
        Job job = service.createJob(JobCreateRequest.immediate("flaky", "welcome", List.of("a@example.com")));
        dispatcher.tick();

        transportDown = false;
        clock.set(service.getJob(job.getId()).getNextRunAt());
        assertEquals(1, dispatcher.tick());

        job = service.getJob(job.getId());
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(0, job.getRetryCount());
        assertNull(job.getLastError());
        assertEquals(List.of("a@example.com:Attempt 2"), delivered);
    }

    @Test
    void shouldNeverDispatchCancelledJob() {
        Job job = service.createJob(JobCreateRequest.immediate("cancel me", "welcome", List.of("a@example.com")));
        service.cancelJob(job.getId());

        assertEquals(0, dispatcher.tick());
        assertTrue(delivered.isEmpty());
        assertTrue(repositories.executions.isEmpty());
    }

    @Test
    void shouldFailJobWithUnknownTemplateOrUnmatchedFilter() {
        Job unknownTemplate = service.createJob(JobCreateRequest.immediate("t", "missing", List.of("a@example.com")));
        Job noMatch = service.createJob(new JobCreateRequest("f", "welcome", ScheduleKind.IMMEDIATE, null, null, null,
                Map.of("department", "legal"), 0));

        assertEquals(2, dispatcher.tick());

        assertEquals(JobStatus.FAILED, service.getJob(unknownTemplate.getId()).getStatus());
        assertThat(service.getJob(unknownTemplate.getId()).getLastError()).contains("missing");
        assertEquals(JobStatus.DEAD_LETTER, service.getJob(noMatch.getId()).getStatus());
        assertTrue(delivered.isEmpty());
    }
}
