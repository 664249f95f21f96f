package com.autobulk.api;

import com.autobulk.Job;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record JobView(
        UUID id,
        String name,
        String templateId,
        String scheduleKind,
        OffsetDateTime runAt,
        String cronExpression,
        String recipientSource,
        List<String> recipients,
        Map<String, String> recipientFilter,
        OffsetDateTime nextRunAt,
        String status,
        int retryCount,
        int maxRetries,
        String lastError,
        boolean cancelled,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    static JobView from(Job job) {
        return new JobView(
                job.getId(),
                job.getName(),
                job.getTemplateId(),
                job.getScheduleKind().storedValue(),
                job.getRunAt(),
                job.getCronExpression(),
                job.getRecipientSource().storedValue(),
                job.getRecipients(),
                job.getRecipientFilter(),
                job.getNextRunAt(),
                job.getStatus().storedValue(),
                job.getRetryCount(),
                job.getMaxRetries(),
                job.getLastError(),
                job.isCancelled(),
                job.getCreatedAt(),
                job.getUpdatedAt());
    }
}
