package com.autobulk.internal;

import com.autobulk.Job;
import com.autobulk.ScheduleKind;
import com.autobulk.error.InvalidScheduleException;
import com.autobulk.error.UnsupportedScheduleException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Maps a schedule definition and a reference time to the next run time. Holds no state; every
 * result is expressed in UTC.
 */
@Component
public class ScheduleCalculator {

    public OffsetDateTime computeNextRun(Job job, OffsetDateTime referenceTime) {
        return computeNextRun(job.getScheduleKind(), job.getRunAt(), job.getCronExpression(), referenceTime);
    }

    public OffsetDateTime computeNextRun(ScheduleKind kind, OffsetDateTime runAt, String cronExpression,
            OffsetDateTime referenceTime) {
        if (referenceTime == null) {
            throw new IllegalArgumentException("referenceTime must not be null");
        }
        OffsetDateTime reference = referenceTime.withOffsetSameInstant(ZoneOffset.UTC);
        if (kind == null) {
            throw new UnsupportedScheduleException("Unsupported schedule kind: null");
        }
        return switch (kind) {
            case IMMEDIATE -> reference;
            case DELAYED -> {
                if (runAt == null) {
                    throw new InvalidScheduleException("Delayed jobs must define run_at");
                }
                yield runAt.withOffsetSameInstant(ZoneOffset.UTC);
            }
            case RECURRING -> nextFireTime(cronExpression, reference);
        };
    }

    /**
     * Parses a cron expression, accepting both 5-field crontab syntax and Spring's 6-field syntax.
     */
    public CronExpression parseCron(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidScheduleException("Recurring jobs require a cron expression");
        }
        String trimmed = cronExpression.trim();
        String normalized = trimmed;
        if (!trimmed.startsWith("@")) {
            int fields = trimmed.split("\\s+").length;
            if (fields == 5) {
                normalized = "0 " + trimmed;
            } else if (fields != 6) {
                throw new InvalidScheduleException(
                        "Invalid cron expression '" + trimmed + "': expected 5 or 6 fields but found " + fields);
            }
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }
    }

    private OffsetDateTime nextFireTime(String cronExpression, OffsetDateTime reference) {
        CronExpression cron = parseCron(cronExpression);
        OffsetDateTime next = cron.next(reference);
        if (next == null) {
            throw new InvalidScheduleException("Cron expression '" + cronExpression.trim() + "' never fires after " + reference);
        }
        return next;
    }
}
