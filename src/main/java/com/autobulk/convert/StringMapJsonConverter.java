package com.autobulk.convert;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class StringMapJsonConverter extends JsonColumnConverter<Map<String, String>> {

    public StringMapJsonConverter() {
        super(new TypeReference<>() {
        });
    }
}
