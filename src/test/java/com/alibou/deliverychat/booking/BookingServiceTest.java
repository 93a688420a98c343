package com.alibou.deliverychat.booking;

import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BookingServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static final Identity CUSTOMER = Identity.of("c-1", Role.CUSTOMER);
    private static final Identity PARTNER  = Identity.of("p-1", Role.DELIVERY_PARTNER);
    private static final Identity ADMIN    = Identity.of("ops", Role.ADMINISTRATOR);

    private final BookingRepository bookings = mock(BookingRepository.class);
    private final BookingStatusLogRepository statusLogs = mock(BookingStatusLogRepository.class);
    private final ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);

    private BookingService service;

    @BeforeEach
    void setUp() {
        service = new BookingService(bookings, statusLogs, events, Clock.fixed(NOW, ZoneOffset.UTC));
        when(bookings.save(any(Booking.class))).thenAnswer(inv -> {
            Booking b = inv.getArgument(0);
            if (b.getId() == null) {
                b.setId(1L);
            }
            return b;
        });
    }

    @Test
    void customerCreatesPendingBooking() {
        Booking booking = service.create(CUSTOMER, "Depot 4", "Main St 1", "ring twice");

        assertThat(booking.getId()).isEqualTo(1L);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.getCustomerId()).isEqualTo("c-1");
        assertThat(booking.getPartnerId()).isNull();

        ArgumentCaptor<BookingStatusLog> entry = ArgumentCaptor.forClass(BookingStatusLog.class);
        verify(statusLogs).save(entry.capture());
        assertThat(entry.getValue().getFromStatus()).isNull();
        assertThat(entry.getValue().getToStatus()).isEqualTo(BookingStatus.PENDING);
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void onlyCustomersCreateBookings() {
        assertThatThrownBy(() -> service.create(PARTNER, "a", "b", null)).isInstanceOf(SecurityException.class);
    }

    @Test
    void assigningAPendingBookingOpensTheChat() {
        existing(BookingStatus.PENDING, null);

        Booking booking = service.assign(1L, "p-1", ADMIN);

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.ASSIGNED);
        assertThat(booking.getPartnerId()).isEqualTo("p-1");
        assertThat(booking.getAssignedAt()).isEqualTo(NOW);
        verify(events).publishEvent(new BookingStatusChangedEvent(1L, BookingStatus.PENDING, BookingStatus.ASSIGNED, "ops"));
    }

    @Test
    void onlyAdministratorsAssign() {
        assertThatThrownBy(() -> service.assign(1L, "p-1", CUSTOMER)).isInstanceOf(SecurityException.class);
        verify(bookings, never()).findById(any());
    }

    @Test
    void changingThePartnerOfAnActiveBookingPublishesAReassignment() {
        existing(BookingStatus.STARTED, "p-1");

        Booking booking = service.assign(1L, "p-2", ADMIN);

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.STARTED);
        assertThat(booking.getPartnerId()).isEqualTo("p-2");
        verify(events).publishEvent(new PartnerReassignedEvent(1L, "p-1", "p-2"));
        verify(events, never()).publishEvent(any(BookingStatusChangedEvent.class));
    }

    @Test
    void assigningTheSamePartnerAgainChangesNothing() {
        existing(BookingStatus.STARTED, "p-1");

        service.assign(1L, "p-1", ADMIN);

        verify(bookings, never()).save(any(Booking.class));
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void finishedBookingsCannotBeReassigned() {
        existing(BookingStatus.DELIVERED, "p-1");

        assertThatThrownBy(() -> service.assign(1L, "p-2", ADMIN)).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void assignedPartnerMovesTheBookingForward() {
        Booking booking = existing(BookingStatus.ASSIGNED, "p-1");

        service.updateStatus(1L, BookingStatus.STARTED, PARTNER, "leaving depot");

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.STARTED);
        assertThat(booking.getStartedAt()).isEqualTo(NOW);
        verify(events).publishEvent(new BookingStatusChangedEvent(1L, BookingStatus.ASSIGNED, BookingStatus.STARTED, "p-1"));
    }

    @Test
    void repeatedStatusUpdateIsIgnored() {
        existing(BookingStatus.STARTED, "p-1");

        service.updateStatus(1L, BookingStatus.STARTED, PARTNER, null);

        verify(bookings, never()).save(any(Booking.class));
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void deliveryPublishesTheChatClosingTransition() {
        Booking booking = existing(BookingStatus.COLLECTED, "p-1");

        service.updateStatus(1L, BookingStatus.DELIVERED, ADMIN, null);

        assertThat(booking.getDeliveredAt()).isEqualTo(NOW);
        verify(events).publishEvent(new BookingStatusChangedEvent(1L, BookingStatus.COLLECTED, BookingStatus.DELIVERED, "ops"));
    }

    @Test
    void onlyTheAssignedPartnerOrAnAdministratorUpdatesStatus() {
        existing(BookingStatus.ASSIGNED, "p-1");

        assertThatThrownBy(() -> service.updateStatus(1L, BookingStatus.STARTED, Identity.of("p-2", Role.DELIVERY_PARTNER), null))
                .isInstanceOf(SecurityException.class);
        assertThatThrownBy(() -> service.updateStatus(1L, BookingStatus.STARTED, CUSTOMER, null))
                .isInstanceOf(SecurityException.class);
    }

    @Test
    void statusCannotSkipAhead() {
        existing(BookingStatus.ASSIGNED, "p-1");

        assertThatThrownBy(() -> service.updateStatus(1L, BookingStatus.COLLECTED, PARTNER, null))
                .isInstanceOf(InvalidTransitionException.class);
        verify(bookings, never()).save(any(Booking.class));
    }

    @Test
    void customerCancelsBeforePickupStarts() {
        Booking booking = existing(BookingStatus.ASSIGNED, "p-1");

        service.cancel(1L, CUSTOMER, "changed my mind");

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(booking.getCancellationReason()).isEqualTo("changed my mind");
        assertThat(booking.getCancelledAt()).isEqualTo(NOW);
        verify(events).publishEvent(new BookingStatusChangedEvent(1L, BookingStatus.ASSIGNED, BookingStatus.CANCELLED, "c-1"));
    }

    @Test
    void startedBookingsCannotBeCancelled() {
        Booking booking = existing(BookingStatus.STARTED, "p-1");

        assertThatThrownBy(() -> service.cancel(1L, CUSTOMER, "too slow"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(booking.getCancellationReason()).isNull();
    }

    @Test
    void partnersCannotCancel() {
        existing(BookingStatus.ASSIGNED, "p-1");

        assertThatThrownBy(() -> service.updateStatus(1L, BookingStatus.CANCELLED, PARTNER, null))
                .isInstanceOf(SecurityException.class);
        assertThatThrownBy(() -> service.cancel(1L, Identity.of("c-2", Role.CUSTOMER), null))
                .isInstanceOf(SecurityException.class);
    }

    @Test
    void historyIsHiddenFromOutsiders() {
        existing(BookingStatus.ASSIGNED, "p-1");

        assertThatThrownBy(() -> service.history(1L, Identity.of("c-2", Role.CUSTOMER)))
                .isInstanceOf(SecurityException.class);
        assertThat(service.history(1L, ADMIN)).isEmpty();
    }

    @Test
    void cancelOfAnUnknownBookingIsReported() {
        when(bookings.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.cancel(9L, ADMIN, null)).isInstanceOf(BookingNotFoundException.class);
    }

    @Test
    void participantsListTheirOwnBookingsAndAdministratorsListAll() {
        Booking open = Booking.builder().id(1L).customerId("c-1").partnerId("p-1")
                .status(BookingStatus.STARTED).createdAt(NOW).build();
        Booking done = Booking.builder().id(2L).customerId("c-1").partnerId("p-1")
                .status(BookingStatus.DELIVERED).createdAt(NOW.minusSeconds(60)).build();
        when(bookings.findAllByCustomerIdOrderByCreatedAtDesc("c-1")).thenReturn(List.of(open, done));
        when(bookings.findAllByPartnerIdOrderByCreatedAtDesc("p-1")).thenReturn(List.of(open, done));
        when(bookings.findAll(Sort.by(Sort.Direction.DESC, "createdAt"))).thenReturn(List.of(open, done));

        assertThat(service.listFor(CUSTOMER, false)).containsExactly(open, done);
        assertThat(service.listFor(PARTNER, true)).containsExactly(open);
        assertThat(service.listFor(ADMIN, true)).containsExactly(open);
        verify(bookings).findAllByPartnerIdOrderByCreatedAtDesc("p-1");
    }

    @Test
    void unknownBookingIsReported() {
        when(bookings.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get(9L, ADMIN)).isInstanceOf(BookingNotFoundException.class);
        assertThat(service.findRecord(9L)).isEmpty();
    }

    private Booking existing(BookingStatus status, String partnerId) {
        Booking booking = Booking.builder()
                .id(1L)
                .customerId("c-1")
                .partnerId(partnerId)
                .status(status)
                .createdAt(NOW.minusSeconds(3600))
                .build();
        when(bookings.findById(1L)).thenReturn(Optional.of(booking));
        return booking;
    }
}
