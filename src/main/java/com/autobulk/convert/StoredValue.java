package com.autobulk.convert;

/**
 * An enum constant with a stable string representation used only at the storage boundary.
 */
public interface StoredValue {

    String storedValue();
}
