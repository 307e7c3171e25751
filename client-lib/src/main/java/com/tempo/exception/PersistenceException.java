package com.tempo.exception;

import java.nio.file.Path;

public class PersistenceException extends TempoException {
    public PersistenceException(Path file, Throwable cause) {
        super("failed to write jobs file " + file + ": " + cause.getMessage(), cause);
    }
}
