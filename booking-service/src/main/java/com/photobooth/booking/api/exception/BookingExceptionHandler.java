package com.photobooth.booking.api.exception;

import com.photobooth.booking.exception.BookingValidationException;
import com.photobooth.booking.exception.SlotUnavailableException;
import com.photobooth.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Booking-specific failures that need more than the generic 400 of
 * {@link com.photobooth.common.exception.GlobalExceptionHandler}: validation errors carry the
 * full message list, a taken slot answers 409 with the blocking booking ids.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    @ExceptionHandler(BookingValidationException.class)
    public ResponseEntity<BaseResponse<List<String>>> handleValidation(BookingValidationException ex) {
        log.warn("Booking validation failed: {}", ex.getErrors());
        BaseResponse<List<String>> response = BaseResponse.error(
                "Booking draft is invalid", ex.getErrorCode(), ex.getErrors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(SlotUnavailableException.class)
    public ResponseEntity<BaseResponse<List<String>>> handleSlotUnavailable(SlotUnavailableException ex) {
        log.warn("Slot unavailable: {}", ex.getMessage());
        BaseResponse<List<String>> response = BaseResponse.error(
                ex.getMessage(), ex.getErrorCode(), ex.getConflictingIds());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }
}
