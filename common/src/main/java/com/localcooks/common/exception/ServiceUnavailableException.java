package com.localcooks.common.exception;

/**
 * A dependency the request needs (idempotency store, database) is temporarily down.
 * Callers retry with the same idempotency key. Mapped to HTTP 503 when it reaches the web layer.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
