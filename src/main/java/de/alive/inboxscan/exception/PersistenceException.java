package de.alive.inboxscan.exception;

import java.nio.file.Path;

public class PersistenceException extends RuntimeException {

    private final Path path;
    private final Operation operation;

    public enum Operation {
        LOAD_SCANNED_IDS,
        PERSIST_SCANNED_IDS,
        WRITE_REPORT,
        READ_SELECTION,
        WRITE_OUTCOME_LOG
    }

    public PersistenceException(String message, Path path, Operation operation, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.operation = operation;
    }

    public Path getPath() {
        return path;
    }

    public Operation getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return String.format("PersistenceException{operation=%s, path=%s, message='%s'}",
                operation, path, getMessage());
    }
}
