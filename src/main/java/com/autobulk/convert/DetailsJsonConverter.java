package com.autobulk.convert;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class DetailsJsonConverter extends JsonColumnConverter<Map<String, Object>> {

    public DetailsJsonConverter() {
        super(new TypeReference<>() {
        });
    }
}
