package com.autobulk.api;

import com.autobulk.Job;
import com.autobulk.JobCreateRequest;
import com.autobulk.ScheduleKind;
import com.autobulk.SchedulingService;
import com.autobulk.error.InvalidJobRequestException;
import com.autobulk.error.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * JSON admin endpoints over {@link SchedulingService}. Disabled unless {@code autobulk.api.enabled=true}.
 */
@RestController
@RequestMapping("/autobulk/api/jobs")
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "autobulk.api", name = "enabled", havingValue = "true")
public class JobAdminController {

    private static final Logger log = LoggerFactory.getLogger(JobAdminController.class);

    private final SchedulingService schedulingService;

    public JobAdminController(SchedulingService schedulingService) {
        this.schedulingService = schedulingService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobView> createJob(@RequestBody CreateJobPayload payload) {
        Job job = schedulingService.createJob(new JobCreateRequest(
                payload.name(),
                payload.templateId(),
                parseScheduleKind(payload.scheduleKind()),
                payload.runAt(),
                payload.cronExpression(),
                payload.recipients(),
                payload.recipientFilter(),
                payload.maxRetries()));
        return ResponseEntity.status(HttpStatus.CREATED).body(JobView.from(job));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<JobView> listJobs() {
        return schedulingService.listJobs().stream().map(JobView::from).toList();
    }

    @GetMapping(value = "/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobView getJob(@PathVariable UUID jobId) {
        return JobView.from(schedulingService.getJob(jobId));
    }

    @PostMapping(value = "/{jobId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobView cancelJob(@PathVariable UUID jobId) {
        return JobView.from(schedulingService.cancelJob(jobId));
    }

    @GetMapping(value = "/{jobId}/executions", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<JobExecutionView> recentExecutions(
            @PathVariable UUID jobId,
            @RequestParam(name = "limit", defaultValue = "10") int limit) {
        return schedulingService.recentExecutions(jobId, limit).stream().map(JobExecutionView::from).toList();
    }

    // InvalidScheduleException is an IllegalArgumentException as well.
    @ExceptionHandler({ IllegalArgumentException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        log.debug("Rejected autobulk API request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ApiError(status.value(), status.getReasonPhrase(), message));
    }

    private static ScheduleKind parseScheduleKind(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScheduleKind kind : ScheduleKind.values()) {
            if (kind.storedValue().equals(normalized)) {
                return kind;
            }
        }
        throw new InvalidJobRequestException("Unknown scheduleKind '" + value + "'");
    }
}
