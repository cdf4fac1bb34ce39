package com.pharmaforecast.exception;

import java.util.UUID;

public class JobNotFoundException extends PharmaForecastException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Job with id '" + jobId + "' not found.");
    }
}
