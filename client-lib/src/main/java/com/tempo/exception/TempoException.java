package com.tempo.exception;

/**
 * Base type for every failure raised by the job store, the job model and the scheduler.
 */
public class TempoException extends RuntimeException {
    public TempoException(String message) {
        super(message);
    }

    public TempoException(String message, Throwable cause) {
        super(message, cause);
    }
}
