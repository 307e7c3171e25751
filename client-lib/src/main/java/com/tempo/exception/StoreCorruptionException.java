package com.tempo.exception;

import java.nio.file.Path;

public class StoreCorruptionException extends TempoException {
    public StoreCorruptionException(Path file, Throwable cause) {
        super("failed to load jobs from " + file + ": " + cause.getMessage(), cause);
    }
}
