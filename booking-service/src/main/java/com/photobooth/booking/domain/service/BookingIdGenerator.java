package com.photobooth.booking.domain.service;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Issues booking ids. Random UUIDs: unique for all practical purposes, not a security token.
 */
@Component
public class BookingIdGenerator {

    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
