package com.autobulk.internal;

import com.autobulk.JobStatus;
import com.autobulk.config.AutobulkProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Exponential backoff from a base delay, capped at a maximum delay (30s and 10 minutes by default),
 * and the retry versus dead-letter decision taken after each failed execution.
 */
@Component
public class RetryPolicy {

    // Beyond this exponent every realistic base delay is already past the cap.
    private static final int MAX_EXPONENT = 30;

    private final long baseDelaySeconds;
    private final long maxDelaySeconds;

    @Autowired
    public RetryPolicy(AutobulkProperties properties) {
        this(properties.getJobs().getRetryBaseDelayInSeconds(), properties.getJobs().getRetryMaxDelayInSeconds());
    }

    RetryPolicy(long baseDelaySeconds, long maxDelaySeconds) {
        if (baseDelaySeconds <= 0) {
            throw new IllegalArgumentException("retry base delay must be > 0");
        }
        if (maxDelaySeconds < baseDelaySeconds) {
            throw new IllegalArgumentException("retry max delay must be >= retry base delay");
        }
        this.baseDelaySeconds = baseDelaySeconds;
        this.maxDelaySeconds = maxDelaySeconds;
    }

    /**
     * Delay before the given attempt is retried: {@code min(max, base * 2^(attempt - 1))}.
     *
     * @param attemptNumber 1-based failure count
     */
    public Duration retryDelay(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        int exponent = Math.min(attemptNumber - 1, MAX_EXPONENT);
        long factor = 1L << exponent;
        long seconds = baseDelaySeconds > maxDelaySeconds / factor ? maxDelaySeconds : baseDelaySeconds * factor;
        return Duration.ofSeconds(Math.min(maxDelaySeconds, seconds));
    }

    /**
     * Decides what happens to a job whose execution just failed.
     *
     * @param currentRetryCount the job's retry counter before this failure
     * @param maxRetries        the job's retry threshold
     * @param now               failure time
     */
    public RetryDecision onFailure(int currentRetryCount, int maxRetries, OffsetDateTime now) {
        int nextRetryCount = currentRetryCount + 1;
        if (nextRetryCount > maxRetries) {
            return new RetryDecision(nextRetryCount, JobStatus.DEAD_LETTER, null);
        }
        return new RetryDecision(nextRetryCount, JobStatus.FAILED, now.plus(retryDelay(nextRetryCount)));
    }

    public record RetryDecision(int retryCount, JobStatus status, OffsetDateTime nextRunAt) {

        public boolean isDeadLetter() {
            return status == JobStatus.DEAD_LETTER;
        }
    }
}
