package com.photobooth.booking.domain.service;

import com.photobooth.booking.domain.model.Booking;
import com.photobooth.booking.domain.model.Booking.BookingStatus;
import com.photobooth.booking.domain.model.TimeSlot;
import com.photobooth.booking.domain.repository.BookingRepository;
import com.photobooth.common.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static com.photobooth.booking.support.BookingFixtures.booking;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

    @Mock
    private BookingRepository bookingRepository;

    @InjectMocks
    private AvailabilityService availabilityService;

    @Test
    @DisplayName("09:30 + 60 min conflicts with 09:00-10:00, 10:00 + 30 min does not")
    void isAvailable_overlapExample() {
        // given
        when(bookingRepository.findAll()).thenReturn(List.of(
                booking("b1", "2026-05-01T09:00:00Z", "2026-05-01T10:00:00Z", "classic", BookingStatus.BOOKED)));

        // when / then
        assertThat(availabilityService.isAvailable(Instant.parse("2026-05-01T09:30:00Z"), 60)).isFalse();
        assertThat(availabilityService.isAvailable(Instant.parse("2026-05-01T10:00:00Z"), 30)).isTrue();
    }

    @Test
    @DisplayName("back-to-back bookings on the same package are both available")
    void isAvailable_touching() {
        when(bookingRepository.findAll()).thenReturn(List.of(
                booking("b1", "2026-05-01T10:00:00Z", "2026-05-01T11:00:00Z", "classic", BookingStatus.CONFIRMED)));

        assertThat(availabilityService.isAvailable(Instant.parse("2026-05-01T11:00:00Z"), 60, "classic")).isTrue();
        assertThat(availabilityService.isAvailable(Instant.parse("2026-05-01T09:00:00Z"), 60, "classic")).isTrue();
    }

    @Test
    @DisplayName("cancelled bookings never block")
    void isAvailable_ignoresCancelled() {
        when(bookingRepository.findAll()).thenReturn(List.of(
                booking("b1", "2026-05-01T09:00:00Z", "2026-05-01T10:00:00Z", "classic", BookingStatus.CANCELLED)));

        assertThat(availabilityService.isAvailable(Instant.parse("2026-05-01T09:00:00Z"), 60, "classic")).isTrue();
    }

    @Test
    @DisplayName("other packages are separate resources, unassigned bookings block every package")
    void findConflicts_packageScope() {
        Booking otherPackage = booking("b1", "2026-05-01T09:00:00Z", "2026-05-01T10:00:00Z", "deluxe", BookingStatus.BOOKED);
        Booking unassigned = booking("b2", "2026-05-01T09:30:00Z", "2026-05-01T10:30:00Z", null, BookingStatus.BOOKED);
        when(bookingRepository.findAll()).thenReturn(List.of(otherPackage, unassigned));

        List<Booking> conflicts = availabilityService.findConflicts(Instant.parse("2026-05-01T09:00:00Z"), 60, "classic");

        assertThat(conflicts).extracting(Booking::getId).containsExactly("b2");
    }

    @Test
    @DisplayName("without a package every active booking blocks")
    void findConflicts_noPackage() {
        when(bookingRepository.findAll()).thenReturn(List.of(
                booking("b1", "2026-05-01T09:00:00Z", "2026-05-01T10:00:00Z", "deluxe", BookingStatus.BOOKED),
                booking("b2", "2026-05-01T09:30:00Z", "2026-05-01T10:30:00Z", "classic", BookingStatus.DRAFT)));

        List<Booking> conflicts = availabilityService.findConflicts(Instant.parse("2026-05-01T09:45:00Z"), 10, null);

        assertThat(conflicts).extracting(Booking::getId).containsExactly("b1", "b2");
    }

    @Test
    @DisplayName("non-positive duration is rejected before the store is read")
    void isAvailable_invalidDuration() {
        assertThatThrownBy(() -> availabilityService.isAvailable(Instant.parse("2026-05-01T09:00:00Z"), 0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> availabilityService.isAvailable(null, 30))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(bookingRepository);
    }

    @Test
    @DisplayName("an exact slot ending seconds into a booking conflicts with it")
    void findConflicts_exactSlot() {
        when(bookingRepository.findAll()).thenReturn(List.of(
                booking("b1", "2026-05-01T10:30:00Z", "2026-05-01T11:30:00Z", "classic", BookingStatus.BOOKED)));

        TimeSlot candidate = new TimeSlot(Instant.parse("2026-05-01T09:00:00Z"), Instant.parse("2026-05-01T10:30:30Z"));

        assertThat(availabilityService.findConflicts(candidate, "classic"))
                .extracting(Booking::getId).containsExactly("b1");
    }

    @Test
    @DisplayName("an empty or reversed slot is rejected before the store is read")
    void findConflicts_invalidSlot() {
        Instant at = Instant.parse("2026-05-01T09:00:00Z");

        assertThatThrownBy(() -> availabilityService.findConflicts(new TimeSlot(at, at), "classic"))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> availabilityService.findConflicts(new TimeSlot(at, at.minusSeconds(60)), null))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> availabilityService.findConflicts((TimeSlot) null, null))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(bookingRepository);
    }
}
