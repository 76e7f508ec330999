package com.photobooth.booking.domain.service;

import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.model.StatusChange;
import com.photobooth.booking.domain.repository.BookingRepository;
import com.photobooth.booking.domain.repository.RecordStoreBookingRepository;
import com.photobooth.booking.store.InMemoryRecordStore;
import com.photobooth.booking.support.BookingFixtures;
import com.photobooth.common.exception.InvalidInputException;
import com.photobooth.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.photobooth.booking.support.BookingFixtures.booking;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against the in-memory store so every call goes through a full read-modify-write cycle.
 */
class BookingStatusServiceTest {

    private BookingRepository repository;
    private BookingStatusService statusService;

    @BeforeEach
    void setUp() {
        Clock clock = BookingFixtures.fixedClock();
        BookingNormalizer normalizer = new BookingNormalizer(
                new TimestampParser(clock), new BookingIdGenerator(), BookingFixtures.objectMapper());
        repository = new RecordStoreBookingRepository(new InMemoryRecordStore(), normalizer, BookingFixtures.objectMapper());
        repository.saveAll(List.of(
                booking("b1", "2026-05-01T09:00:00Z", "2026-05-01T10:00:00Z", "classic", BookingStatus.BOOKED)));
        statusService = new BookingStatusService(repository, clock);
    }

    @Test
    @DisplayName("each call appends exactly one history entry matching the new status")
    void applyStatus_historyGrowsByOne() {
        Booking confirmed = statusService.applyStatus("b1", BookingStatus.CONFIRMED, "deposit received");
        assertThat(confirmed.getStatusHistory()).hasSize(2);

        Booking completed = statusService.applyStatus("b1", "completed", null);
        assertThat(completed.getStatusHistory()).hasSize(3);
        assertThat(completed.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(completed.getLastStatusChange()).map(StatusChange::status).contains(BookingStatus.COMPLETED);

        assertThat(repository.findById("b1")).get()
                .extracting(Booking::getStatus).isEqualTo(BookingStatus.COMPLETED);
    }

    @Test
    @DisplayName("re-applying the current status still records an entry")
    void applyStatus_sameStatusAppends() {
        Booking result = statusService.applyStatus("b1", BookingStatus.BOOKED, "re-sent");

        assertThat(result.getStatusHistory()).hasSize(2);
        assertThat(result.getStatusHistory().get(1).reason()).isEqualTo("re-sent");
        assertThat(result.getUpdatedAt()).isEqualTo(BookingFixtures.NOW);
    }

    @Test
    @DisplayName("history timestamps never go backwards when the clock does")
    void applyStatus_monotonicHistory() {
        statusService.applyStatus("b1", BookingStatus.CONFIRMED, null);
        BookingStatusService lateClock = new BookingStatusService(repository,
                Clock.fixed(BookingFixtures.NOW.minusSeconds(86_400), ZoneOffset.UTC));

        Booking result = lateClock.applyStatus("b1", BookingStatus.CANCELLED, "customer request");

        List<StatusChange> history = result.getStatusHistory();
        Instant previous = history.get(history.size() - 2).at();
        assertThat(history.get(history.size() - 1).at()).isAfterOrEqualTo(previous);
        assertThat(result.getUpdatedAt()).isAfterOrEqualTo(result.getCreatedAt());
    }

    @Test
    @DisplayName("unknown id raises ResourceNotFoundException")
    void applyStatus_notFound() {
        assertThatThrownBy(() -> statusService.applyStatus("missing", BookingStatus.CONFIRMED, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("unknown status raises InvalidInputException")
    void applyStatus_invalidStatus() {
        assertThatThrownBy(() -> statusService.applyStatus("b1", "archived", null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("archived");
    }
}
