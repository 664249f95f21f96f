package com.autobulk.api;

import com.autobulk.JobExecution;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record JobExecutionView(
        UUID id,
        UUID jobId,
        String status,
        int attempt,
        OffsetDateTime startedAt,
        OffsetDateTime finishedAt,
        String error,
        int emailsSent,
        Map<String, Object> details) {

    static JobExecutionView from(JobExecution execution) {
        return new JobExecutionView(
                execution.getId(),
                execution.getJobId(),
                execution.getStatus().storedValue(),
                execution.getAttempt(),
                execution.getStartedAt(),
                execution.getFinishedAt(),
                execution.getError(),
                execution.getEmailsSent(),
                execution.getDetails());
    }
}
