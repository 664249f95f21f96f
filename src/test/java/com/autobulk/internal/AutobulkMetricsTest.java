package com.autobulk.internal;

import com.autobulk.JobRepository;
import com.autobulk.JobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutobulkMetricsTest {

    private JobRepository jobRepository;
    private MeterRegistry meterRegistry;
    private AutobulkMetrics autobulkMetrics;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        autobulkMetrics = new AutobulkMetrics(jobRepository, meterRegistry);
    }

    @Test
    void shouldRegisterGaugesForJobStatuses() {
        when(jobRepository.countByStatus()).thenReturn(List.of(
                count(JobStatus.SCHEDULED, 10L),
                count(JobStatus.RUNNING, 2L),
                count(JobStatus.DEAD_LETTER, 1L)));

        autobulkMetrics.registerMetrics();

        Gauge scheduledGauge = meterRegistry.find("autobulk.jobs.count").tag("status", "scheduled").gauge();
        assertThat(scheduledGauge).isNotNull();
        assertThat(scheduledGauge.value()).isEqualTo(10.0);

        Gauge deadLetterGauge = meterRegistry.find("autobulk.jobs.count").tag("status", "dead_letter").gauge();
        assertThat(deadLetterGauge).isNotNull();
        assertThat(deadLetterGauge.value()).isEqualTo(1.0);

        Gauge completedGauge = meterRegistry.find("autobulk.jobs.count").tag("status", "completed").gauge();
        assertThat(completedGauge).isNotNull();
        assertThat(completedGauge.value()).isEqualTo(0.0);

        Gauge totalGauge = meterRegistry.find("autobulk.jobs.total").gauge();
        assertThat(totalGauge).isNotNull();
        assertThat(totalGauge.value()).isEqualTo(13.0);

        verify(jobRepository, times(1)).countByStatus();
    }

    @Test
    void shouldReportZeroWhenCountQueryFails() {
        when(jobRepository.countByStatus()).thenThrow(new IllegalStateException("database down"));

        autobulkMetrics.registerMetrics();

        assertThat(meterRegistry.find("autobulk.jobs.total").gauge().value()).isEqualTo(0.0);
    }

    private static JobRepository.StatusCount count(JobStatus status, long total) {
        return new JobRepository.StatusCount() {
            @Override
            public JobStatus getStatus() {
                return status;
            }

            @Override
            public Long getTotal() {
                return total;
            }
        };
    }
}
