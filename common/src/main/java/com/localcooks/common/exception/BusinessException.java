package com.localcooks.common.exception;

import lombok.Getter;

/**
 * Base for domain rule violations. Subclasses pick the error code;
 * the HTTP status is decided by whichever advice handles them.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        this(message, "BUSINESS_ERROR");
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
