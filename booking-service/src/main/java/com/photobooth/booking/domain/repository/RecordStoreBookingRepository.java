package com.photobooth.booking.domain.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.service.BookingNormalizer;
import com.photobooth.booking.store.RecordStore;
import com.photobooth.common.exception.ResourceNotFoundException;
import com.photobooth.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Slf4j
@Repository
@RequiredArgsConstructor
public class RecordStoreBookingRepository implements BookingRepository {

    private final RecordStore recordStore;
    private final BookingNormalizer normalizer;
    private final ObjectMapper objectMapper;

    @Value("${photobooth.store.bookings-key:" + Constants.BOOKINGS_KEY + "}")
    private String bookingsKey = Constants.BOOKINGS_KEY;

    @Override
    public List<Booking> findAll() {
        return normalizer.normalizeAll(recordStore.get(bookingsKey));
    }

    @Override
    public Optional<Booking> findById(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return findAll().stream()
                .filter(b -> id.equals(b.getId()))
                .findFirst()
                .map(Booking::copy);
    }

    @Override
    public Booking append(Booking booking) {
        List<Booking> all = findAll();
        all.add(booking.copy());
        saveAll(all);
        log.debug("Appended booking {} ({} total)", booking.getId(), all.size());
        return booking.copy();
    }

    @Override
    public Booking update(String id, UnaryOperator<Booking> mutation) {
        List<Booking> all = findAll();
        for (int i = 0; i < all.size(); i++) {
            if (Objects.equals(id, all.get(i).getId())) {
                Booking updated = mutation.apply(all.get(i).copy());
                all.set(i, updated);
                saveAll(all);
                return updated.copy();
            }
        }
        throw new ResourceNotFoundException("Booking", id);
    }

    @Override
    public void saveAll(List<Booking> bookings) {
        String json;
        try {
            json = objectMapper.writeValueAsString(bookings);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} booking(s)", bookings.size(), e);
            throw new IllegalStateException("Booking serialization failed", e);
        }
        recordStore.set(bookingsKey, json);
        log.debug("Saved {} booking(s) under key {}", bookings.size(), bookingsKey);
    }
}
