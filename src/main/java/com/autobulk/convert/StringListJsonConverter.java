package com.autobulk.convert;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class StringListJsonConverter extends JsonColumnConverter<List<String>> {

    public StringListJsonConverter() {
        super(new TypeReference<>() {
        });
    }
}
