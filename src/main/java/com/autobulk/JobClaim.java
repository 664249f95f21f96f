package com.autobulk;

/**
 * A job that the dispatch loop has moved to {@code running}, together with the execution opened
 * for this attempt. Both were committed before any external work starts.
 */
public record JobClaim(Job job, JobExecution execution) {
}
