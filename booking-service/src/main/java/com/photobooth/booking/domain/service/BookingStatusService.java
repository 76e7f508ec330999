package com.photobooth.booking.domain.service;

import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.model.StatusChange;
import com.photobooth.booking.domain.repository.BookingRepository;
import com.photobooth.common.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Assigns booking statuses.
 *
 * Any status may follow any other, including itself. Every call appends one entry to the
 * status history and refreshes {@code updatedAt}, so the history records each attempt and
 * two writers applying the same transition both leave a trace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStatusService {

    private final BookingRepository bookingRepository;
    private final Clock clock;

    public Booking applyStatus(String id, String status, String reason) {
        return applyStatus(id, BookingStatus.fromValue(status), reason);
    }

    public Booking applyStatus(String id, BookingStatus newStatus, String reason) {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Booking id is required");
        }
        if (newStatus == null) {
            throw new InvalidInputException("Status is required");
        }

        Booking updated = bookingRepository.update(id, booking -> {
            Instant now = clock.instant();
            // normalized bookings always carry at least one history entry
            List<StatusChange> history = new ArrayList<>(booking.getStatusHistory());
            Instant last = history.get(history.size() - 1).at();
            Instant at = latest(latest(now, last), booking.getCreatedAt());
            history.add(new StatusChange(newStatus, at, reason));

            booking.setStatus(newStatus);
            booking.setStatusHistory(history);
            booking.setUpdatedAt(at);
            return booking;
        });

        log.info("Booking {} status set to {} (history size {}){}", id, newStatus.getValue(),
                updated.getStatusHistory().size(), reason == null ? "" : ": " + reason);
        return updated;
    }

    private static Instant latest(Instant a, Instant b) {
        return b != null && b.isAfter(a) ? b : a;
    }
}
