package com.autobulk;

import com.autobulk.convert.StoredValue;

public enum ExecutionStatus implements StoredValue {
    PENDING("pending"),
    RUNNING("running"),
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String storedValue;

    ExecutionStatus(String storedValue) {
        this.storedValue = storedValue;
    }

    @Override
    public String storedValue() {
        return storedValue;
    }
}
