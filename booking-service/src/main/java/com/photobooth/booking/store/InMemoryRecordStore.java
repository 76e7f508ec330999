package com.photobooth.booking.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local record store for development and tests.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public String get(String key) {
        return values.get(key);
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
    }
}
