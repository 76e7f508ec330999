package com.photobooth.common.exception;

/**
 * Thrown when an operation references a record that is not in the store,
 * usually a stale id held by the caller.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String message) {
        super(message, ERROR_CODE);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), ERROR_CODE);
    }
}
