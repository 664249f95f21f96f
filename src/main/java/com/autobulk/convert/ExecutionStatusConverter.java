package com.autobulk.convert;

import com.autobulk.ExecutionStatus;
import jakarta.persistence.Converter;

@Converter
public class ExecutionStatusConverter extends StoredEnumConverter<ExecutionStatus> {

    public ExecutionStatusConverter() {
        super(ExecutionStatus.class);
    }
}
