package com.alibou.deliverychat.booking.dto;

import com.alibou.deliverychat.booking.BookingStatus;
import com.alibou.deliverychat.booking.BookingStatusLog;

import java.time.Instant;

public record StatusLogResponse(
        Long id,
        BookingStatus from,
        BookingStatus to,
        String actorId,
        String note,
        Instant timestamp) {

    public static StatusLogResponse from(BookingStatusLog entry) {
        return new StatusLogResponse(entry.getId(), entry.getFromStatus(), entry.getToStatus(),
                entry.getActorId(), entry.getNote(), entry.getCreatedAt());
    }
}
