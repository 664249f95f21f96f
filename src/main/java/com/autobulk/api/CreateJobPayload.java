package com.autobulk.api;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * JSON body of {@code POST /autobulk/api/jobs}. The schedule kind is one of {@code immediate},
 * {@code delayed} or {@code recurring}.
 */
public record CreateJobPayload(
        String name,
        String templateId,
        String scheduleKind,
        OffsetDateTime runAt,
        String cronExpression,
        List<String> recipients,
        Map<String, String> recipientFilter,
        Integer maxRetries) {
}
