package com.photobooth.common.exception;

import lombok.Getter;

/**
 * Thrown when the backing record store cannot accept a write.
 * Mapped to HTTP 503; the client may retry the whole operation.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {
    public static final String ERROR_CODE = "SERVICE_UNAVAILABLE";

    /** Store key whose write failed, or null when the outage is not tied to one key. */
    private final String storeKey;

    public ServiceUnavailableException(String message) {
        this(message, null, null);
    }

    private ServiceUnavailableException(String message, String storeKey, Throwable cause) {
        super(message, cause);
        this.storeKey = storeKey;
    }

    /**
     * A write of {@code storeKey} was refused by the store. Nothing was persisted.
     */
    public static ServiceUnavailableException storeWriteFailed(String storeKey, Throwable cause) {
        return new ServiceUnavailableException(
                String.format("Booking store temporarily unavailable, write to %s was not saved. Retry later.", storeKey),
                storeKey, cause);
    }
}
