package com.photobooth.booking.store;

import com.photobooth.common.exception.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Record store backed by plain Redis string values.
 *
 * Reads degrade to "absent" when Redis is unreachable so callers see an empty collection;
 * writes fail loudly with {@link ServiceUnavailableException} because losing a write silently
 * would drop a booking.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisRecordStore implements RecordStore {

    private final StringRedisTemplate stringRedisTemplate;

    @Override
    public String get(String key) {
        try {
            return stringRedisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            log.error("Redis read failed for key: {}, treating value as absent", key, e);
            return null;
        }
    }

    @Override
    public void set(String key, String value) {
        try {
            stringRedisTemplate.opsForValue().set(key, value);
            log.debug("Wrote {} chars to Redis key: {}", value.length(), key);
        } catch (DataAccessException e) {
            log.warn("Redis write failed for key: {}", key, e);
            throw ServiceUnavailableException.storeWriteFailed(key, e);
        }
    }
}
