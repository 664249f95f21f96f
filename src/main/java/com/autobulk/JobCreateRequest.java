package com.autobulk;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Input of {@link SchedulingService#createJob(JobCreateRequest)}. Exactly one of {@code recipients}
 * and {@code recipientFilter} must be given; {@code maxRetries} falls back to the configured
 * default when null.
 */
public record JobCreateRequest(
        String name,
        String templateId,
        ScheduleKind scheduleKind,
        OffsetDateTime runAt,
        String cronExpression,
        List<String> recipients,
        Map<String, String> recipientFilter,
        Integer maxRetries) {

    public static JobCreateRequest immediate(String name, String templateId, List<String> recipients) {
        return new JobCreateRequest(name, templateId, ScheduleKind.IMMEDIATE, null, null, recipients, null, null);
    }

    public static JobCreateRequest delayed(String name, String templateId, OffsetDateTime runAt,
            List<String> recipients) {
        return new JobCreateRequest(name, templateId, ScheduleKind.DELAYED, runAt, null, recipients, null, null);
    }

    public static JobCreateRequest recurring(String name, String templateId, String cronExpression,
            Map<String, String> recipientFilter) {
        return new JobCreateRequest(name, templateId, ScheduleKind.RECURRING, null, cronExpression, null,
                recipientFilter, null);
    }

    public JobCreateRequest withMaxRetries(Integer retries) {
        return new JobCreateRequest(name, templateId, scheduleKind, runAt, cronExpression, recipients,
                recipientFilter, retries);
    }
}
