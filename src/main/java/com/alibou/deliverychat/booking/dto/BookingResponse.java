package com.alibou.deliverychat.booking.dto;

import com.alibou.deliverychat.booking.Booking;
import com.alibou.deliverychat.booking.BookingStateMachine;
import com.alibou.deliverychat.booking.BookingStatus;

import java.time.Instant;
import java.util.Set;

public record BookingResponse(
        Long id,
        String customerId,
        String partnerId,
        BookingStatus status,
        boolean chatActive,
        boolean cancellable,
        Set<BookingStatus> nextStatuses,
        String pickupAddress,
        String deliveryAddress,
        String cancellationReason,
        Instant createdAt,
        Instant updatedAt) {

    public static BookingResponse from(Booking b) {
        return new BookingResponse(
                b.getId(),
                b.getCustomerId(),
                b.getPartnerId(),
                b.getStatus(),
                BookingStateMachine.isChatActive(b.getStatus()),
                BookingStateMachine.isCancellable(b.getStatus()),
                BookingStateMachine.nextValidStatuses(b.getStatus()),
                b.getPickupAddress(),
                b.getDeliveryAddress(),
                b.getCancellationReason(),
                b.getCreatedAt(),
                b.getUpdatedAt());
    }
}
