package com.autobulk.internal;

import com.autobulk.Job;
import com.autobulk.JobClaim;
import com.autobulk.JobExecution;
import com.autobulk.JobStatus;
import com.autobulk.JobStore;
import com.autobulk.MutableClock;
import com.autobulk.RecipientSource;
import com.autobulk.ScheduleKind;
import com.autobulk.delivery.BulkSendResult;
import com.autobulk.delivery.DispatchContext;
import com.autobulk.delivery.MessageSender;
import com.autobulk.delivery.RecipientResolver;
import com.autobulk.delivery.RenderedMessage;
import com.autobulk.delivery.TemplateRenderer;
import com.autobulk.error.DeliveryException;
import com.autobulk.error.InvalidScheduleException;
import com.autobulk.error.RenderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobDispatcherTest {

    private static final OffsetDateTime NOON = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private JobStore jobStore;
    private RecipientResolver recipientResolver;
    private TemplateRenderer templateRenderer;
    private MessageSender messageSender;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        jobStore = mock(JobStore.class);
        recipientResolver = mock(RecipientResolver.class);
        templateRenderer = mock(TemplateRenderer.class);
        messageSender = mock(MessageSender.class);
        dispatcher = new JobDispatcher(jobStore, recipientResolver, templateRenderer, messageSender,
                new MutableClock(NOON));

        when(recipientResolver.resolve(any(Job.class))).thenReturn(List.of("a@example.com", "b@example.com"));
        when(templateRenderer.render(anyString(), any(DispatchContext.class)))
                .thenAnswer(invocation -> new RenderedMessage(invocation.getArgument(0), "subject", "body"));
        when(messageSender.sendBulk(any(RenderedMessage.class), any(), any(DispatchContext.class)))
                .thenAnswer(invocation -> new BulkSendResult(
                        invocation.<RenderedMessage>getArgument(0).templateId(),
                        invocation.<List<String>>getArgument(1).size()));
        when(jobStore.recordSuccess(any(UUID.class), anyInt(), anyMap(), any(OffsetDateTime.class)))
                .thenAnswer(invocation -> completed());
    }

    @Test
    void shouldReturnZeroWhenNothingIsDue() {
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of());

        assertEquals(0, dispatcher.tick());
        verify(jobStore, never()).claim(any(UUID.class), any(OffsetDateTime.class));
    }

    @Test
    void shouldDispatchClaimedJobAndRecordSuccess() throws Exception {
        Job job = job();
        JobClaim claim = claimOf(job);
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of(job));
        when(jobStore.claim(job.getId(), NOON)).thenReturn(Optional.of(claim));

        assertEquals(1, dispatcher.tick());

        ArgumentCaptor<DispatchContext> context = ArgumentCaptor.forClass(DispatchContext.class);
        verify(templateRenderer).render(eq("welcome"), context.capture());
        assertEquals(job.getId(), context.getValue().jobId());
        assertEquals(claim.execution().getId(), context.getValue().executionId());
        assertEquals(1, context.getValue().attemptNumber());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(jobStore).recordSuccess(eq(claim.execution().getId()), eq(2), details.capture(), eq(NOON));
        assertEquals(List.of("a@example.com", "b@example.com"), details.getValue().get("recipients"));
        assertEquals("welcome", details.getValue().get("templateId"));
        verify(jobStore, never()).recordFailure(any(UUID.class), anyString(), any(OffsetDateTime.class));
    }

    @Test
    void shouldSkipJobsWhoseClaimIsLost() {
        Job lost = job();
        Job won = job();
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of(lost, won));
        when(jobStore.claim(lost.getId(), NOON)).thenReturn(Optional.empty());
        when(jobStore.claim(won.getId(), NOON)).thenReturn(Optional.of(claimOf(won)));

        assertEquals(1, dispatcher.tick());
        verify(jobStore, times(1)).recordSuccess(any(UUID.class), anyInt(), anyMap(), any(OffsetDateTime.class));
    }

    @Test
    void shouldRecordCollaboratorFailures() throws Exception {
        Job rendering = job();
        Job delivering = job();
        JobClaim renderClaim = claimOf(rendering);
        JobClaim deliveryClaim = claimOf(delivering);
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of(rendering, delivering));
        when(jobStore.claim(rendering.getId(), NOON)).thenReturn(Optional.of(renderClaim));
        when(jobStore.claim(delivering.getId(), NOON)).thenReturn(Optional.of(deliveryClaim));
        doThrow(new RenderException("Unknown template 'broken'"))
                .when(templateRenderer).render(eq("broken"), any(DispatchContext.class));
        rendering.setTemplateId("broken");
        doThrow(new DeliveryException("SMTP down"))
                .when(messageSender).sendBulk(any(RenderedMessage.class), any(), eq(contextOf(deliveryClaim)));

        assertEquals(2, dispatcher.tick());

        verify(jobStore).recordFailure(renderClaim.execution().getId(), "Unknown template 'broken'", NOON);
        verify(jobStore).recordFailure(deliveryClaim.execution().getId(), "SMTP down", NOON);
        verify(jobStore, never()).recordSuccess(any(UUID.class), anyInt(), anyMap(), any(OffsetDateTime.class));
    }

    @Test
    void shouldTreatUnexpectedExceptionsAsFailures() throws Exception {
        Job job = job();
        JobClaim claim = claimOf(job);
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of(job));
        when(jobStore.claim(job.getId(), NOON)).thenReturn(Optional.of(claim));
        when(recipientResolver.resolve(job)).thenThrow(new IllegalStateException());

        assertEquals(1, dispatcher.tick());

        verify(jobStore).recordFailure(claim.execution().getId(), "IllegalStateException", NOON);
    }

    @Test
    void shouldRecordBrokenScheduleAfterDispatchAsFailure() {
        Job job = job();
        JobClaim claim = claimOf(job);
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of(job));
        when(jobStore.claim(job.getId(), NOON)).thenReturn(Optional.of(claim));
        doThrow(new InvalidScheduleException("Cron expression 'x' never fires"))
                .when(jobStore).recordSuccess(any(UUID.class), anyInt(), anyMap(), any(OffsetDateTime.class));

        assertEquals(1, dispatcher.tick());

        verify(jobStore).recordFailure(claim.execution().getId(), "Cron expression 'x' never fires", NOON);
    }

    @Test
    void shouldContinueTickWhenStoreFailsForOneJob() {
        Job broken = job();
        Job healthy = job();
        JobClaim brokenClaim = claimOf(broken);
        JobClaim healthyClaim = claimOf(healthy);
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of(broken, healthy));
        when(jobStore.claim(broken.getId(), NOON)).thenReturn(Optional.of(brokenClaim));
        when(jobStore.claim(healthy.getId(), NOON)).thenReturn(Optional.of(healthyClaim));
        doThrow(new IllegalStateException("connection reset"))
                .when(jobStore).recordSuccess(eq(brokenClaim.execution().getId()), anyInt(), anyMap(),
                        any(OffsetDateTime.class));

        assertEquals(2, dispatcher.tick());

        verify(jobStore).recordSuccess(eq(healthyClaim.execution().getId()), eq(2), anyMap(), eq(NOON));
        verify(jobStore, never()).recordFailure(any(UUID.class), anyString(), any(OffsetDateTime.class));
    }

    @Test
    void shouldSkipClaimThatThrows() {
        Job job = job();
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of(job));
        when(jobStore.claim(job.getId(), NOON)).thenThrow(new IllegalStateException("deadlock"));

        assertEquals(0, dispatcher.tick());
    }

    @Test
    void shouldReturnZeroWhileAnotherTickIsRunning() throws Exception {
        Job job = job();
        CountDownLatch insideTick = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(jobStore.listDueJobs(NOON)).thenAnswer(invocation -> {
            insideTick.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of(job);
        });
        when(jobStore.claim(job.getId(), NOON)).thenReturn(Optional.of(claimOf(job)));

        AtomicInteger firstResult = new AtomicInteger(-1);
        Thread first = new Thread(() -> firstResult.set(dispatcher.tick()));
        first.start();
        assertTrue(insideTick.await(5, TimeUnit.SECONDS));

        assertEquals(0, dispatcher.tick());

        release.countDown();
        first.join(5000);
        assertEquals(1, firstResult.get());
    }

    @Test
    void shouldRunSingleTickWhenRunOnce() {
        when(jobStore.listDueJobs(NOON)).thenReturn(List.of());

        dispatcher.start(Duration.ofMinutes(10), true);

        verify(jobStore, times(1)).listDueJobs(NOON);
    }

    @Test
    void shouldStopLoopWhenInterrupted() throws Exception {
        AtomicInteger ticks = new AtomicInteger();
        when(jobStore.listDueJobs(NOON)).thenAnswer(invocation -> {
            ticks.incrementAndGet();
            return List.of();
        });

        Thread loop = new Thread(() -> dispatcher.start(Duration.ofMillis(10), false));
        loop.start();
        Thread.sleep(100);
        loop.interrupt();
        loop.join(5000);

        assertFalse(loop.isAlive());
        assertThat(ticks.get()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void shouldSurviveTickFailuresInLoop() {
        when(jobStore.listDueJobs(NOON)).thenThrow(new IllegalStateException("database down"));

        dispatcher.start(Duration.ZERO, true);

        verify(jobStore).listDueJobs(NOON);
    }

    @Test
    void shouldRejectNegativePollInterval() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.start(Duration.ofSeconds(-1), true));
    }

    @Test
    void shouldRejectZeroPollIntervalForContinuousLoop() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.start(Duration.ZERO, false));

        verifyNoInteractions(jobStore);
    }

    private Job job() {
        Job job = new Job(UUID.randomUUID(), "campaign", "welcome", ScheduleKind.IMMEDIATE, 3);
        job.setRecipientSource(RecipientSource.STATIC_LIST);
        job.setRecipients(List.of("a@example.com", "b@example.com"));
        job.setNextRunAt(NOON);
        return job;
    }

    private JobClaim claimOf(Job job) {
        job.setStatus(JobStatus.RUNNING);
        return new JobClaim(job, JobExecution.start(job, NOON));
    }

    private DispatchContext contextOf(JobClaim claim) {
        return new DispatchContext(claim.job().getId(), claim.execution().getId(), claim.execution().getAttempt());
    }

    private Job completed() {
        Job job = job();
        job.setStatus(JobStatus.COMPLETED);
        job.setNextRunAt(null);
        return job;
    }
}
