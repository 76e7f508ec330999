package com.photobooth.common.exception;

/**
 * Thrown when a caller passes structurally impossible arguments
 * (non-positive duration, missing start, unknown status name).
 */
public class InvalidInputException extends BusinessException {
    public static final String ERROR_CODE = "INVALID_INPUT";

    public InvalidInputException(String message) {
        super(message, ERROR_CODE);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE);
    }
}
