package com.autobulk.convert;

import com.autobulk.ScheduleKind;
import jakarta.persistence.Converter;

@Converter
public class ScheduleKindConverter extends StoredEnumConverter<ScheduleKind> {

    public ScheduleKindConverter() {
        super(ScheduleKind.class);
    }
}
