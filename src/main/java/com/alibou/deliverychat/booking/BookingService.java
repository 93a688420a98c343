package com.alibou.deliverychat.booking;

import com.alibou.deliverychat.user.Identity;
import com.alibou.deliverychat.user.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Жизненный цикл брони: создание, назначение курьера, смена статуса и отмена.
 * Каждое принятое изменение пишется в историю статусов и публикуется событием
 * после коммита. Из двух параллельных команд над одной бронью коммитится
 * первая; вторая падает на {@link Booking#getVersion()} и получает 409.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements BookingLookup {

    private final BookingRepository          bookings;
    private final BookingStatusLogRepository statusLogs;
    private final ApplicationEventPublisher  events;
    private final Clock                      clock;

    /* =======================================================================
                                   QUERIES
       ======================================================================= */

    @Override
    @Transactional(readOnly = true)
    public Optional<BookingRecord> findRecord(long bookingId) {
        return bookings.findById(bookingId).map(Booking::toRecord);
    }

    @Transactional(readOnly = true)
    public Booking get(long bookingId, Identity viewer) {
        Booking booking = load(bookingId);
        requireVisible(booking, viewer);
        return booking;
    }

    /**
     * Брони, которые видит участник: свои для клиента и курьера, все для
     * администратора. Новые сверху.
     */
    @Transactional(readOnly = true)
    public List<Booking> listFor(Identity viewer, boolean activeOnly) {
        List<Booking> visible = switch (viewer.role()) {
            case CUSTOMER         -> bookings.findAllByCustomerIdOrderByCreatedAtDesc(viewer.id());
            case DELIVERY_PARTNER -> bookings.findAllByPartnerIdOrderByCreatedAtDesc(viewer.id());
            case ADMINISTRATOR    -> bookings.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
        };
        return activeOnly
                ? visible.stream().filter(b -> !b.getStatus().isTerminal()).toList()
                : visible;
    }

    @Transactional(readOnly = true)
    public List<BookingStatusLog> history(long bookingId, Identity viewer) {
        requireVisible(load(bookingId), viewer);
        return statusLogs.findAllByBookingIdOrderByIdAsc(bookingId);
    }

    /* =======================================================================
                                  COMMANDS
       ======================================================================= */

    @Transactional
    public Booking create(Identity customer, String pickupAddress, String deliveryAddress, String notes) {
        if (customer.role() != Role.CUSTOMER) {
            throw new SecurityException("Only customers can create bookings");
        }
        Instant now = clock.instant();
        Booking booking = bookings.save(Booking.builder()
                .customerId(customer.id())
                .status(BookingStatus.PENDING)
                .pickupAddress(pickupAddress)
                .deliveryAddress(deliveryAddress)
                .customerNotes(notes)
                .createdAt(now)
                .updatedAt(now)
                .build());
        recordHistory(booking.getId(), null, BookingStatus.PENDING, customer, "Booking created", now);
        log.info("🆕 Бронь {} создана клиентом {}", booking.getId(), customer.id());
        return booking;
    }

    /**
     * Назначает курьера на бронь в PENDING или передаёт активную бронь
     * другому курьеру.
     */
    @Transactional
    public Booking assign(long bookingId, String partnerId, Identity actor) {
        requireAdministrator(actor, "assign partners");
        Booking booking = load(bookingId);
        BookingStatus status = booking.getStatus();

        if (status == BookingStatus.PENDING) {
            booking.setPartnerId(partnerId);
            applyTransition(booking, BookingStatus.ASSIGNED, actor, "Assigned to " + partnerId);
            return booking;
        }
        if (!BookingStateMachine.isChatActive(status)) {
            throw new InvalidTransitionException(status, BookingStatus.ASSIGNED);
        }
        if (partnerId.equals(booking.getPartnerId())) {
            log.info("Бронь {} уже назначена на {}, ничего не делаем", bookingId, partnerId);
            return booking;
        }

        String previous = booking.getPartnerId();
        Instant now = clock.instant();
        booking.setPartnerId(partnerId);
        booking.setAssignedAt(now);
        booking.setUpdatedAt(now);
        bookings.save(booking);
        recordHistory(bookingId, status, status, actor, "Reassigned from " + previous + " to " + partnerId, now);
        events.publishEvent(new PartnerReassignedEvent(bookingId, previous, partnerId));
        log.info("🔁 Бронь {} передана {} ↔ {} (кто: {})", bookingId, previous, partnerId, actor.id());
        return booking;
    }

    /** Шаг вперёд от назначенного курьера или администратора. */
    @Transactional
    public Booking updateStatus(long bookingId, BookingStatus target, Identity actor, String note) {
        if (target == BookingStatus.CANCELLED) {
            return cancel(bookingId, actor, note);
        }
        Booking booking = load(bookingId);
        if (!actor.isAdministrator() && !booking.toRecord().isAssignedPartner(actor)) {
            throw new SecurityException("You cannot update the status of booking " + bookingId);
        }
        if (target == BookingStatus.ASSIGNED && booking.getStatus() != BookingStatus.ASSIGNED) {
            throw new IllegalArgumentException("Use the assign operation to move a booking to assigned");
        }
        applyTransition(booking, target, actor, note);
        return booking;
    }

    @Transactional
    public Booking cancel(long bookingId, Identity actor, String reason) {
        Booking booking = load(bookingId);
        if (!actor.isAdministrator() && !booking.toRecord().isCustomer(actor)) {
            throw new SecurityException("You cannot cancel booking " + bookingId);
        }
        BookingStatus status = booking.getStatus();
        if (status != BookingStatus.CANCELLED) {
            if (!BookingStateMachine.isCancellable(status)) {
                throw new InvalidTransitionException(status, BookingStatus.CANCELLED);
            }
            booking.setCancellationReason(reason);
        }
        applyTransition(booking, BookingStatus.CANCELLED, actor, reason);
        return booking;
    }

    /* =======================================================================
                                  HELPERS
       ======================================================================= */

    private boolean applyTransition(Booking booking, BookingStatus target, Identity actor, String note) {
        BookingStatus from = booking.getStatus();
        if (!BookingStateMachine.transition(from, target)) {
            log.info("Бронь {} уже {}, повторный запрос от {} пропущен",
                    booking.getId(), target.wireName(), actor.id());
            return false;
        }

        Instant now = clock.instant();
        booking.setStatus(target);
        booking.setUpdatedAt(now);
        stamp(booking, target, now);
        bookings.save(booking);

        recordHistory(booking.getId(), from, target, actor, note, now);
        events.publishEvent(new BookingStatusChangedEvent(booking.getId(), from, target, actor.id()));
        log.info("📦 Бронь {}: {} → {} (кто: {})", booking.getId(), from.wireName(), target.wireName(), actor.id());
        return true;
    }

    private void stamp(Booking booking, BookingStatus status, Instant at) {
        switch (status) {
            case ASSIGNED  -> booking.setAssignedAt(at);
            case STARTED   -> booking.setStartedAt(at);
            case REACHED   -> booking.setReachedAt(at);
            case COLLECTED -> booking.setCollectedAt(at);
            case DELIVERED -> booking.setDeliveredAt(at);
            case CANCELLED -> booking.setCancelledAt(at);
            default        -> { }
        }
    }

    private void recordHistory(Long bookingId, BookingStatus from, BookingStatus to,
                               Identity actor, String note, Instant at) {
        statusLogs.save(BookingStatusLog.builder()
                .bookingId(bookingId)
                .fromStatus(from)
                .toStatus(to)
                .actorId(actor.id())
                .note(note)
                .createdAt(at)
                .build());
    }

    private Booking load(long bookingId) {
        return bookings.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    private void requireVisible(Booking booking, Identity viewer) {
        if (!booking.toRecord().isVisibleTo(viewer)) {
            throw new SecurityException("Booking " + booking.getId() + " is not accessible");
        }
    }

    private void requireAdministrator(Identity actor, String action) {
        if (!actor.isAdministrator()) {
            throw new SecurityException("Only administrators can " + action);
        }
    }
}
