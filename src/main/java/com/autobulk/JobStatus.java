package com.autobulk;

import com.autobulk.convert.StoredValue;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus implements StoredValue {
    SCHEDULED("scheduled"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    DEAD_LETTER("dead_letter");

    /**
     * Statuses the dispatch loop may claim. A failed job waiting for its retry is still schedulable.
     */
    public static final Set<JobStatus> CLAIMABLE = EnumSet.of(SCHEDULED, FAILED);

    private final String storedValue;

    JobStatus(String storedValue) {
        this.storedValue = storedValue;
    }

    @Override
    public String storedValue() {
        return storedValue;
    }

    /**
     * Terminal statuses never carry a next run time.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == DEAD_LETTER;
    }
}
