package com.autobulk.internal;

import com.autobulk.JobRepository;
import com.autobulk.JobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class AutobulkMetrics {

    private static final Logger log = LoggerFactory.getLogger(AutobulkMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<JobStatus, Long> cachedSnapshot = Map.of();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public AutobulkMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering autobulk gauges...");

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("autobulk.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of autobulk jobs")
                    .tag("status", status.storedValue())
                    .register(meterRegistry);
        }

        Gauge.builder("autobulk.jobs.total", this, AutobulkMetrics::totalCount)
                .description("Total number of autobulk jobs in the database")
                .register(meterRegistry);
    }

    private double countFor(JobStatus status) {
        return getSnapshot().getOrDefault(status, 0L);
    }

    private double totalCount() {
        long total = 0;
        for (long count : getSnapshot().values()) {
            total += count;
        }
        return total;
    }

    private Map<JobStatus, Long> getSnapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private Map<JobStatus, Long> loadSnapshot() {
        try {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobRepository.StatusCount row : jobRepository.countByStatus()) {
                if (row.getStatus() != null) {
                    counts.put(row.getStatus(), row.getTotal() == null ? 0L : row.getTotal());
                }
            }
            return counts;
        } catch (Exception e) {
            log.trace("Failed to query status counts for metrics: {}", e.getMessage());
            return Map.of();
        }
    }
}
