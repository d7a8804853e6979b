package com.tessera.database.retry;

/**
 * Thrown when a storage operation keeps failing transiently after every retry.
 * <p>
 * WHY separate from access errors: an unavailable store must surface as a server error. It is
 * never reported as "forbidden" or "not found".
 */
public class StorageUnavailableException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public StorageUnavailableException(String operation, int attempts, Throwable cause) {
        super("Storage operation '%s' failed after %d attempt(s)".formatted(operation, attempts), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}
