package com.photobooth.booking.store;

/**
 * Flat key-value store holding serialized collections.
 *
 * No transactions and no locking: concurrent writers of the same key overwrite each other.
 */
public interface RecordStore {

    /**
     * @return the stored value, or {@code null} when the key is absent or cannot be read
     */
    String get(String key);

    void set(String key, String value);
}
