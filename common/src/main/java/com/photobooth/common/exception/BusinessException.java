package com.photobooth.common.exception;

import lombok.Getter;

import java.util.Objects;

/**
 * Base exception for booking-domain rule violations.
 * Carries a stable error code that is returned to API clients; every subclass names its own.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }
}
