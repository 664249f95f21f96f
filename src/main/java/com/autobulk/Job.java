package com.autobulk;

import com.autobulk.convert.JobStatusConverter;
import com.autobulk.convert.RecipientSourceConverter;
import com.autobulk.convert.ScheduleKindConverter;
import com.autobulk.convert.StringListJsonConverter;
import com.autobulk.convert.StringMapJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "autobulk_jobs")
public class Job {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "template_id", nullable = false)
    private String templateId;

    @Convert(converter = ScheduleKindConverter.class)
    @Column(name = "schedule_kind", nullable = false)
    private ScheduleKind scheduleKind;

    @Column(name = "run_at")
    private OffsetDateTime runAt;

    @Column(name = "cron_expression")
    private String cronExpression;

    @Convert(converter = RecipientSourceConverter.class)
    @Column(name = "recipient_source", nullable = false)
    private RecipientSource recipientSource;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "recipients")
    private List<String> recipients;

    @Convert(converter = StringMapJsonConverter.class)
    @Column(name = "recipient_filter")
    private Map<String, String> recipientFilter;

    @Column(name = "next_run_at")
    private OffsetDateTime nextRunAt;

    @Convert(converter = JobStatusConverter.class)
    @Column(nullable = false)
    private JobStatus status = JobStatus.SCHEDULED;

    @Column(name = "retry_count")
    private int retryCount = 0;

    @Column(name = "max_retries")
    private int maxRetries = 3;

    @Column(name = "last_error")
    private String lastError;

    @Column(name = "cancelled")
    private boolean cancelled = false;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public Job() {
    }

    public Job(UUID id, String name, String templateId, ScheduleKind scheduleKind, int maxRetries) {
        this.id = id;
        this.name = name;
        this.templateId = templateId;
        this.scheduleKind = scheduleKind;
        this.maxRetries = maxRetries;
    }

    /**
     * Takes the job out of the schedule for good. The dispatch loop never claims a cancelled job.
     */
    public void cancel(OffsetDateTime now) {
        this.status = JobStatus.CANCELLED;
        this.cancelled = true;
        this.nextRunAt = null;
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public ScheduleKind getScheduleKind() {
        return scheduleKind;
    }

    public void setScheduleKind(ScheduleKind scheduleKind) {
        this.scheduleKind = scheduleKind;
    }

    public OffsetDateTime getRunAt() {
        return runAt;
    }

    public void setRunAt(OffsetDateTime runAt) {
        this.runAt = runAt;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public RecipientSource getRecipientSource() {
        return recipientSource;
    }

    public void setRecipientSource(RecipientSource recipientSource) {
        this.recipientSource = recipientSource;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public void setRecipients(List<String> recipients) {
        this.recipients = recipients;
    }

    public Map<String, String> getRecipientFilter() {
        return recipientFilter;
    }

    public void setRecipientFilter(Map<String, String> recipientFilter) {
        this.recipientFilter = recipientFilter;
    }

    public OffsetDateTime getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(OffsetDateTime nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
