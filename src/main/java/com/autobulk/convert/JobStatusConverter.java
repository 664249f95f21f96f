package com.autobulk.convert;

import com.autobulk.JobStatus;
import jakarta.persistence.Converter;

@Converter
public class JobStatusConverter extends StoredEnumConverter<JobStatus> {

    public JobStatusConverter() {
        super(JobStatus.class);
    }
}
