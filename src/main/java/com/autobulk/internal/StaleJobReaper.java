package com.autobulk.internal;

import com.autobulk.JobStore;
import com.autobulk.config.AutobulkProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Releases jobs left in {@code running} by a crashed dispatch. Does nothing unless
 * {@code autobulk.worker.stale-running-timeout} is set. The timeout should exceed the longest
 * expected dispatch; a released dispatch that finishes later is reconciled by {@link JobStore}.
 */
@Component
@ConditionalOnProperty(prefix = "autobulk.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StaleJobReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleJobReaper.class);

    private final JobStore jobStore;
    private final AutobulkProperties properties;
    private final Clock clock;

    public StaleJobReaper(JobStore jobStore, AutobulkProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${autobulk.worker.reaper-interval-in-seconds:60}000")
    public void reap() {
        String timeout = properties.getWorker().getStaleRunningTimeout();
        if (timeout == null || timeout.isBlank()) {
            return;
        }

        try {
            Duration staleAfter = parseDuration(timeout);
            OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
            int released = jobStore.reapStaleRunning(now.minus(staleAfter), now);
            if (released > 0) {
                log.warn("Released {} job(s) stuck in running for longer than {}", released, staleAfter);
            }
        } catch (Exception e) {
            log.error("Failed to release stale running jobs: {}", e.getMessage());
        }
    }

    static Duration parseDuration(String durationStr) {
        String trimmed = durationStr.trim();
        try {
            return Duration.parse(trimmed);
        } catch (RuntimeException ignored) {
            // Fall through to the shorthand forms.
        }

        // Shorthand inputs like "45m", "2h" or "1d".
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        if (shorthand.length() > 1) {
            long amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
            switch (shorthand.charAt(shorthand.length() - 1)) {
                case 's':
                    return Duration.ofSeconds(amount);
                case 'm':
                    return Duration.ofMinutes(amount);
                case 'h':
                    return Duration.ofHours(amount);
                case 'd':
                    return Duration.ofDays(amount);
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Unsupported duration value: " + durationStr);
    }
}
