package com.photobooth.booking.domain.service;

import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.model.TimeSlot;
import com.photobooth.booking.domain.repository.BookingRepository;
import com.photobooth.common.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides whether a candidate time slot collides with stored bookings.
 *
 * Rules:
 * - cancelled bookings never block
 * - with a package id, only unassigned bookings and bookings of the same package block;
 *   other packages are separate resources
 * - overlap is half-open, so back-to-back bookings are allowed
 * - stored records with unreadable dates are dropped by {@link BookingNormalizer} before they
 *   get here, which means corrupt data never blocks a slot
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final BookingRepository bookingRepository;

    public boolean isAvailable(Instant candidateStart, long durationMinutes) {
        return isAvailable(candidateStart, durationMinutes, null);
    }

    public boolean isAvailable(Instant candidateStart, long durationMinutes, String packageId) {
        TimeSlot candidate = candidateSlot(candidateStart, durationMinutes);
        boolean available = bookingRepository.findAll().stream()
                .filter(constrains(packageId))
                .noneMatch(b -> b.getSlot().overlaps(candidate));
        log.debug("Slot {} - {} (package {}) available: {}", candidate.start(), candidate.end(), packageId, available);
        return available;
    }

    /**
     * Same rules as {@link #isAvailable(Instant, long, String)} but reports every blocking booking.
     */
    public List<Booking> findConflicts(Instant candidateStart, long durationMinutes, String packageId) {
        return findConflicts(candidateSlot(candidateStart, durationMinutes), packageId);
    }

    /**
     * Checks the exact interval, seconds included.
     */
    public List<Booking> findConflicts(TimeSlot candidate, String packageId) {
        if (candidate == null || candidate.start() == null || candidate.end() == null
                || !candidate.end().isAfter(candidate.start())) {
            throw new InvalidInputException("Candidate slot must have a start before its end, got " + candidate);
        }
        return bookingRepository.findAll().stream()
                .filter(constrains(packageId))
                .filter(b -> b.getSlot().overlaps(candidate))
                .collect(Collectors.toList());
    }

    private TimeSlot candidateSlot(Instant candidateStart, long durationMinutes) {
        if (candidateStart == null) {
            throw new InvalidInputException("Candidate start is required");
        }
        if (durationMinutes <= 0) {
            throw new InvalidInputException("durationMinutes must be a positive number, got " + durationMinutes);
        }
        return TimeSlot.of(candidateStart, durationMinutes);
    }

    private Predicate<Booking> constrains(String packageId) {
        return b -> {
            if (b.getStatus() == BookingStatus.CANCELLED) {
                return false;
            }
            if (b.getStart() == null || b.getEnd() == null) {
                return false;
            }
            return packageId == null || b.getPackageId() == null || packageId.equals(b.getPackageId());
        };
    }
}
