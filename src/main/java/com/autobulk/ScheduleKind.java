package com.autobulk;

import com.autobulk.convert.StoredValue;

public enum ScheduleKind implements StoredValue {
    /** Runs on the first poll after creation. */
    IMMEDIATE("immediate"),
    /** Runs once at a fixed instant. */
    DELAYED("delayed"),
    /** Runs on every fire time of a cron expression. */
    RECURRING("recurring");

    private final String storedValue;

    ScheduleKind(String storedValue) {
        this.storedValue = storedValue;
    }

    @Override
    public String storedValue() {
        return storedValue;
    }
}
