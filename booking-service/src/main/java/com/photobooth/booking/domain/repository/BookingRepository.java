package com.photobooth.booking.domain.repository;

import com.photobooth.booking.domain.model.Booking;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Booking persistence over a whole-collection record store.
 *
 * Every mutation re-reads the entire collection, changes one entry and writes the entire
 * collection back. Two writers racing on the same store therefore resolve as
 * last-write-wins, and the loser's unrelated changes are lost. A per-record version
 * counter could close that gap without changing this interface.
 */
public interface BookingRepository {

    /**
     * @return normalized copies of every stored booking, in stored order
     */
    List<Booking> findAll();

    Optional<Booking> findById(String id);

    /**
     * Appends a new booking to the stored collection.
     */
    Booking append(Booking booking);

    /**
     * Applies {@code mutation} to the booking with the given id and writes the collection back.
     *
     * @throws com.photobooth.common.exception.ResourceNotFoundException when no booking has the id
     */
    Booking update(String id, UnaryOperator<Booking> mutation);

    void saveAll(List<Booking> bookings);
}
