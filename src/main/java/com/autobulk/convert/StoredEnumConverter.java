package com.autobulk.convert;

import jakarta.persistence.AttributeConverter;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps an enum to and from its {@link StoredValue} string.
 */
public abstract class StoredEnumConverter<E extends Enum<E> & StoredValue> implements AttributeConverter<E, String> {

    private final Class<E> enumType;
    private final Map<String, E> byStoredValue = new HashMap<>();

    protected StoredEnumConverter(Class<E> enumType) {
        this.enumType = enumType;
        for (E constant : enumType.getEnumConstants()) {
            byStoredValue.put(constant.storedValue(), constant);
        }
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.storedValue();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        E constant = byStoredValue.get(dbData);
        if (constant == null) {
            throw new IllegalArgumentException(
                    "Unknown " + enumType.getSimpleName() + " value in storage: '" + dbData + "'");
        }
        return constant;
    }
}
