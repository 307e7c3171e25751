package com.tempo.exception;

public class JobNotFoundException extends TempoException {
    public JobNotFoundException(String jobId) {
        super("job '" + jobId + "' not found");
    }
}
