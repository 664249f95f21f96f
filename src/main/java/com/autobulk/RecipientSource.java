package com.autobulk;

import com.autobulk.convert.StoredValue;

public enum RecipientSource implements StoredValue {
    STATIC_LIST("static_list"),
    FILTER("filter");

    private final String storedValue;

    RecipientSource(String storedValue) {
        this.storedValue = storedValue;
    }

    @Override
    public String storedValue() {
        return storedValue;
    }
}
