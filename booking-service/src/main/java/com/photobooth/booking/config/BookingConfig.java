package com.photobooth.booking.config;

import com.photobooth.booking.store.InMemoryRecordStore;
import com.photobooth.booking.store.RecordStore;
import com.photobooth.booking.store.RedisRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the clock and the record store.
 *
 * Store selection: photobooth.store.type = redis (default) | memory
 */
@Slf4j
@Configuration
public class BookingConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock(@Value("${photobooth.booking.zone:}") String zone) {
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        log.info("Booking clock uses zone {}", zoneId);
        return Clock.system(zoneId);
    }

    @Bean
    @ConditionalOnProperty(name = "photobooth.store.type", havingValue = "redis", matchIfMissing = true)
    public RecordStore redisRecordStore(StringRedisTemplate stringRedisTemplate) {
        log.info("Using Redis record store");
        return new RedisRecordStore(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "photobooth.store.type", havingValue = "memory")
    public RecordStore inMemoryRecordStore() {
        log.warn("Using in-memory record store; bookings are lost on restart");
        return new InMemoryRecordStore();
    }
}
