package com.autobulk.error;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
