package com.tessera.tenancy.domain.exception;

/**
 * Base type of every failure the tenancy layer reports to callers.
 * <p>
 * WHY unchecked: these end a request. They are mapped to HTTP responses in one place,
 * {@code GlobalExceptionHandler}, rather than handled along the way.
 */
public abstract class TenancyException extends RuntimeException {

    protected TenancyException(String message) {
        super(message);
    }

    protected TenancyException(String message, Throwable cause) {
        super(message, cause);
    }
}
